package com.calcifer.dispatch.cli;

import com.calcifer.config.CalciferProperties;
import com.calcifer.core.engine.ProvisioningEngine;
import com.calcifer.core.events.EventBus;
import com.calcifer.core.model.Goal;
import com.calcifer.inventory.InventoryLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: calcifer arc-connect
 */
@Command(name = "arc-connect", mixinStandardHelpOptions = true,
        description = "Connect the cluster to Azure Arc")
@Component
public class ArcConnectCommand extends GoalCommand {

    public ArcConnectCommand(ProvisioningEngine engine, InventoryLoader inventoryLoader,
                             CalciferProperties properties, EventBus eventBus) {
        super(engine, inventoryLoader, properties, eventBus);
    }

    @Override
    protected Goal goal() {
        return Goal.ARC_CONNECT;
    }
}
