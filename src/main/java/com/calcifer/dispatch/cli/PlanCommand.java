package com.calcifer.dispatch.cli;

import com.calcifer.config.CalciferProperties;
import com.calcifer.core.model.Goal;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.Inventory;
import com.calcifer.core.model.TargetFilter;
import com.calcifer.core.registry.ConfigException;
import com.calcifer.core.registry.ExecutionPlan;
import com.calcifer.core.registry.TaskRegistry;
import com.calcifer.core.registry.UnknownGoalException;
import com.calcifer.inventory.InventoryLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: calcifer plan &lt;goal&gt;
 * <p>
 * Prints the steps and tasks a goal resolves to and which hosts each step would touch.
 * Nothing is executed. Without an inventory file only the plan itself is shown.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the execution plan of a goal")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Goal: verify, init, arc-connect, destroy")
    private String goal;

    @Option(names = {"--inventory", "-i"}, description = "Inventory file (default: calcifer.inventory.file)")
    private Path inventory;

    @Option(names = {"--target", "-t"}, description = "Limit to one host name or group")
    private String target;

    private final TaskRegistry registry;
    private final InventoryLoader inventoryLoader;
    private final CalciferProperties properties;

    public PlanCommand(TaskRegistry registry, InventoryLoader inventoryLoader, CalciferProperties properties) {
        this.registry = registry;
        this.inventoryLoader = inventoryLoader;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ExecutionPlan plan;
        Inventory hosts;
        try {
            plan = registry.resolve(Goal.fromName(goal));
            hosts = loadInventory();
        } catch (UnknownGoalException e) {
            ConsoleOutput.error(e.getMessage());
            ConsoleOutput.info("Valid goals: " + Arrays.stream(Goal.values())
                    .map(Goal::cliName).collect(Collectors.joining(", ")));
            return GoalCommand.EXIT_CONFIG_ERROR;
        } catch (ConfigException e) {
            ConsoleOutput.error(e.getMessage());
            return GoalCommand.EXIT_CONFIG_ERROR;
        }

        if (hosts == null) {
            ConsoleOutput.info("No inventory found, showing the plan without hosts");
            ConsoleOutput.plan(plan, group -> null);
        } else {
            Inventory matched = hosts;
            ConsoleOutput.plan(plan, group -> matched.hostsIn(group).stream().map(Host::name).toList());
        }
        return 0;
    }

    private Inventory loadInventory() {
        Path path = inventory != null ? inventory : Path.of(properties.getInventory().getFile());
        if (inventory == null && !Files.exists(path)) {
            return null;
        }
        Inventory loaded = inventoryLoader.load(path);
        return target != null ? loaded.filter(new TargetFilter(target)) : loaded;
    }
}
