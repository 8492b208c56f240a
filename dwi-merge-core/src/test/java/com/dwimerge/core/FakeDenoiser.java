package com.dwimerge.core;

import com.dwimerge.core.denoise.DenoiseResult;
import com.dwimerge.core.denoise.DenoiseSettings;
import com.dwimerge.core.denoise.Denoiser;
import com.dwimerge.core.model.DwiImage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory denoiser for tests: subtracts a fixed offset from every voxel and reports a
 * constant noise map. Records the labels it was called with.
 */
public class FakeDenoiser implements Denoiser {

    public static final float OFFSET = 1.0f;

    private final List<String> labels = new CopyOnWriteArrayList<>();

    @Override
    public String getId() {
        return "fake";
    }

    @Override
    public DenoiseResult denoise(DwiImage image, DenoiseSettings settings, String label) {
        labels.add(label);
        List<float[]> volumes = new ArrayList<>();
        for (float[] volume : image.volumes()) {
            float[] out = new float[volume.length];
            for (int i = 0; i < volume.length; i++) {
                out[i] = volume[i] - OFFSET;
            }
            volumes.add(out);
        }
        return new DenoiseResult(new DwiImage(image.grid(), volumes),
            DwiImage.single(image.grid(), DwiFixtures.constant(image.grid(), OFFSET)));
    }

    public List<String> labels() {
        return List.copyOf(labels);
    }
}
