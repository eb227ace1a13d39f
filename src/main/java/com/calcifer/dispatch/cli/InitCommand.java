package com.calcifer.dispatch.cli;

import com.calcifer.config.CalciferProperties;
import com.calcifer.core.engine.ProvisioningEngine;
import com.calcifer.core.events.EventBus;
import com.calcifer.core.model.Goal;
import com.calcifer.inventory.InventoryLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: calcifer init
 */
@Command(name = "init", mixinStandardHelpOptions = true,
        description = "Prepare nodes, initialize the control plane and join the workers")
@Component
public class InitCommand extends GoalCommand {

    public InitCommand(ProvisioningEngine engine, InventoryLoader inventoryLoader,
                       CalciferProperties properties, EventBus eventBus) {
        super(engine, inventoryLoader, properties, eventBus);
    }

    @Override
    protected Goal goal() {
        return Goal.INIT;
    }
}
