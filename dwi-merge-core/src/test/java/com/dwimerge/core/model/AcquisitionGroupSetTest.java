package com.dwimerge.core.model;

import com.dwimerge.core.DwiFixtures;
import com.dwimerge.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AcquisitionGroupSet}.
 */
class AcquisitionGroupSetTest {

    private final AcquisitionGroup ap = DwiFixtures.standardGroup("dir_AP", 100, DwiFixtures.DIRECTIONS);
    private final AcquisitionGroup pa = DwiFixtures.standardGroup("dir_PA", 200, DwiFixtures.negated(DwiFixtures.DIRECTIONS));

    @Test
    void build_completeSlots_keepsConfiguredOrderAndSanitizesIds() {
        Map<String, Map<ArtifactSlot, Object>> values = new LinkedHashMap<>();
        values.put("dir-PA", DwiFixtures.slots(pa));
        values.put("dir-AP", DwiFixtures.slots(ap));

        AcquisitionGroupSet set = AcquisitionGroupSet.build(List.of("dir-PA", "dir-AP"), values, null);

        assertThat(set.ids()).containsExactly("dir_PA", "dir_AP");
        assertThat(set.totalVolumeCount()).isEqualTo(10);
        assertThat(set.get(0).bvecs()).isEqualTo(pa.bvecs());
    }

    @Test
    void build_missingSlot_namesGroupAndSlot() {
        Map<ArtifactSlot, Object> slots = new HashMap<>(DwiFixtures.slots(ap));
        slots.remove(ArtifactSlot.B0_REF);
        slots.remove(ArtifactSlot.ORIGINAL_BVEC);

        assertThatThrownBy(() -> AcquisitionGroupSet.build(List.of("dir_AP"), Map.of("dir_AP", slots), null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("dir_AP_b0_ref")
            .hasMessageContaining("dir_AP_original_bvec")
            .extracting(e -> ((ValidationException) e).getSubject())
            .isEqualTo("dir_AP");
    }

    @Test
    void build_bvalCountDiffersFromImage_throwsValidationException() {
        Map<ArtifactSlot, Object> slots = new HashMap<>(DwiFixtures.slots(ap));
        slots.put(ArtifactSlot.BVAL, List.of(0.0, 1000.0));

        assertThatThrownBy(() -> AcquisitionGroupSet.build(List.of("dir_AP"), Map.of("dir_AP", slots), null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("5 volumes")
            .hasMessageContaining("bval has 2 rows");
    }

    @Test
    void build_rawConcatenatedImageMissingVolume_throwsValidationExceptionNamingGroup() {
        Map<ArtifactSlot, Object> slots = new HashMap<>(DwiFixtures.slots(ap));
        slots.put(ArtifactSlot.RAW_CONCATENATED_IMAGE, DwiFixtures.image(DwiFixtures.GRID, 100, 11, 12, 13));

        assertThatThrownBy(() -> AcquisitionGroupSet.build(
                List.of("dir_AP", "dir_PA"), Map.of("dir_AP", slots, "dir_PA", DwiFixtures.slots(pa)), null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("dir_AP_raw_concatenated_image has 4")
            .extracting(e -> ((ValidationException) e).getSubject())
            .isEqualTo("dir_AP");
    }

    @Test
    void build_rawConcatenatedImageOnOtherGrid_throwsValidationException() {
        SpatialGrid coarse = new SpatialGrid(2, 2, 2, 2.0, 2.0, 2.0);
        Map<ArtifactSlot, Object> slots = new HashMap<>(DwiFixtures.slots(ap));
        slots.put(ArtifactSlot.RAW_CONCATENATED_IMAGE, DwiFixtures.image(coarse, 100, 11, 12, 13, 14));

        assertThatThrownBy(() -> AcquisitionGroupSet.build(List.of("dir_AP"), Map.of("dir_AP", slots), null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Raw concatenated image grid");
    }

    @Test
    void build_wrongSlotType_throwsValidationException() {
        Map<ArtifactSlot, Object> slots = new HashMap<>(DwiFixtures.slots(ap));
        slots.put(ArtifactSlot.IMAGE, "not an image");

        assertThatThrownBy(() -> AcquisitionGroupSet.build(List.of("dir_AP"), Map.of("dir_AP", slots), null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("must hold an image");
    }

    @Test
    void build_idsCollidingAfterSanitizing_throwsValidationException() {
        Map<String, Map<ArtifactSlot, Object>> values = Map.of(
            "dir-AP", DwiFixtures.slots(ap),
            "dir_AP", DwiFixtures.slots(ap));

        assertThatThrownBy(() -> AcquisitionGroupSet.build(List.of("dir-AP", "dir_AP"), values, null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Duplicate");
    }

    @Test
    void build_noGroups_throwsValidationException() {
        assertThatThrownBy(() -> AcquisitionGroupSet.build(List.of(), Map.of(), null))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void build_confoundRowsDifferFromVolumes_throwsValidationException() {
        ConfoundTable confounds = new ConfoundTable(Map.of("framewise_displacement", List.of(0.1, 0.2)));

        assertThatThrownBy(() -> AcquisitionGroupSet.build(List.of("dir_AP"),
            Map.of("dir_AP", DwiFixtures.slots(ap)), Map.of("dir_AP", confounds)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Confounds have 2 rows");
    }

    @Test
    void fromNamedSlots_flatNames_resolvesEveryGroup() {
        Map<String, Object> named = new HashMap<>();
        DwiFixtures.slots(ap).forEach((slot, value) -> named.put(slot.slotName("dir_AP"), value));
        DwiFixtures.slots(pa).forEach((slot, value) -> named.put(slot.slotName("dir_PA"), value));

        AcquisitionGroupSet set = AcquisitionGroupSet.fromNamedSlots(List.of("dir-AP", "dir-PA"), named);

        assertThat(set.ids()).containsExactly("dir_AP", "dir_PA");
        assertThat(set.slotValues(ArtifactSlot.B0_REF)).hasSize(2);
    }

    @Test
    void fromNamedSlots_missingGroupSlot_throwsValidationException() {
        Map<String, Object> named = new HashMap<>();
        DwiFixtures.slots(ap).forEach((slot, value) -> named.put(slot.slotName("dir_AP"), value));

        assertThatThrownBy(() -> AcquisitionGroupSet.fromNamedSlots(List.of("dir_AP", "dir_PA"), named))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("dir_PA");
    }

    @Test
    void sanitize_replacesDashes() {
        assertThat(AcquisitionGroupSet.sanitize(" dir-AP-run-1 ")).isEqualTo("dir_AP_run_1");
    }
}
