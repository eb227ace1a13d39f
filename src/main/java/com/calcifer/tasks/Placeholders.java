package com.calcifer.tasks;

import com.calcifer.core.task.TaskContext;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code ${...}} placeholders in command templates.
 * <p>
 * Resolution order: {@code host.name}, {@code host.address}, {@code host.user},
 * {@code k8s.minor}, {@code fact.<key>} from the host's facts, then run settings.
 */
final class Placeholders {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_.\\-]+)}");

    private Placeholders() {}

    /**
     * @throws IllegalStateException when a placeholder has no value
     */
    static String render(String template, TaskContext context) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = resolve(key, context);
            if (value == null) {
                throw new IllegalStateException("No value for placeholder ${" + key + "}");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String resolve(String key, TaskContext context) {
        switch (key) {
            case "host.name":
                return context.host().name();
            case "host.address":
                return context.host().address();
            case "host.user":
                return context.host().username();
            case "k8s.minor":
                return context.settings().k8sMinorVersion();
            case "k8s.version":
                return context.settings().k8sVersion();
            default:
                break;
        }
        if (key.startsWith("fact.")) {
            return context.hostFacts().get(key.substring("fact.".length()));
        }
        return context.settings().get(key).orElse(null);
    }
}
