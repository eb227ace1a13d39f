package com.calcifer.dispatch.cli;

import com.calcifer.config.CalciferProperties;
import com.calcifer.core.engine.ProvisioningEngine;
import com.calcifer.core.events.EventBus;
import com.calcifer.core.model.Goal;
import com.calcifer.inventory.InventoryLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: calcifer destroy
 */
@Command(name = "destroy", mixinStandardHelpOptions = true,
        description = "Disconnect from Azure Arc and reset every node")
@Component
public class DestroyCommand extends GoalCommand {

    public DestroyCommand(ProvisioningEngine engine, InventoryLoader inventoryLoader,
                          CalciferProperties properties, EventBus eventBus) {
        super(engine, inventoryLoader, properties, eventBus);
    }

    @Override
    protected Goal goal() {
        return Goal.DESTROY;
    }
}
