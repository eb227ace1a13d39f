package com.calcifer.dispatch.cli;

import com.calcifer.config.CalciferProperties;
import com.calcifer.core.engine.ProvisioningEngine;
import com.calcifer.core.events.EventBus;
import com.calcifer.core.model.Goal;
import com.calcifer.inventory.InventoryLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: calcifer verify
 */
@Command(name = "verify", mixinStandardHelpOptions = true,
        description = "Check connectivity, tooling and Azure login without changing anything")
@Component
public class VerifyCommand extends GoalCommand {

    public VerifyCommand(ProvisioningEngine engine, InventoryLoader inventoryLoader,
                         CalciferProperties properties, EventBus eventBus) {
        super(engine, inventoryLoader, properties, eventBus);
    }

    @Override
    protected Goal goal() {
        return Goal.VERIFY;
    }
}
