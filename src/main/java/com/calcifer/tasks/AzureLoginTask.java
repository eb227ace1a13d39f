package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.backend.HostShell;
import com.calcifer.config.RunSettings;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;

import java.util.Optional;

import static com.calcifer.backend.AbstractHostShell.quote;

/**
 * Confirms the Azure CLI session and selects the configured subscription.
 * In verify mode a different active subscription is only reported.
 */
public class AzureLoginTask implements Task {

    private final boolean verifyOnly;

    public AzureLoginTask(boolean verifyOnly) {
        this.verifyOnly = verifyOnly;
    }

    @Override
    public String name() {
        return verifyOnly ? "verify-azure-login" : "azure-login";
    }

    @Override
    public String description() {
        return verifyOnly ? "Verify Azure CLI authentication" : "Ensure Azure CLI authentication";
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) {
        Optional<String> subscription = context.settings().get(RunSettings.AZURE_SUBSCRIPTION_ID);
        if (subscription.isEmpty()) {
            return TaskOutcome.failed("Azure subscription is not configured (calcifer.azure.subscription-id)");
        }
        HostShell shell = context.shell();
        CommandResult account = shell.run("az account show --query id -o tsv");
        if (!account.succeeded()) {
            return TaskOutcome.failed("Not authenticated to Azure; run 'az login' first");
        }
        String active = account.output();
        if (active.equalsIgnoreCase(subscription.get())) {
            return TaskOutcome.ok("Authenticated, subscription already selected");
        }
        if (verifyOnly) {
            return TaskOutcome.warning("Authenticated, but a different subscription is active");
        }
        CommandResult set = shell.run("az account set --subscription " + quote(subscription.get()));
        if (!set.succeeded()) {
            return TaskOutcome.failed("Logged in, but could not select the configured subscription: " + set.errorSummary());
        }
        return TaskOutcome.changed("Selected configured subscription");
    }
}
