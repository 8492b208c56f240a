package com.dwimerge.cli;

import com.dwimerge.core.merge.MergeStrategies;
import com.dwimerge.core.merge.MergeStrategy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available merge strategies.
 *
 * <p>Discovers strategies via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * dwimerge list strategies
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available merge strategies",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: strategies",
        defaultValue = "strategies"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "strategies", "strategy" -> listStrategies();
            default -> {
                log.error("Unknown type: {}. Use: strategies", type);
                yield ExitCodes.FAILURE;
            }
        };
    }

    private int listStrategies() {
        System.out.println("Available Merge Strategies:");
        System.out.println();

        List<MergeStrategy> strategies = MergeStrategies.available();
        for (MergeStrategy strategy : strategies) {
            System.out.printf("  • %s (ID: %s)%n", strategy.getDisplayName(), strategy.getId());
        }

        if (strategies.isEmpty()) {
            System.out.println("  No merge strategies found.");
        }

        return ExitCodes.OK;
    }
}
