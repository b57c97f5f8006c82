package org.iomclient.cli;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${env:NAME}} placeholders in option values.
 * Unknown variables are left untouched.
 */
public final class EnvironmentVariableEvaluator {

    private static final Pattern ENV_VAR = Pattern.compile("\\$\\{env:([A-Za-z_][A-Za-z0-9_]*)}");

    private EnvironmentVariableEvaluator() {
    }

    public static String resolveEnvVars(String value) {
        return resolveEnvVars(value, System.getenv());
    }

    static String resolveEnvVars(String value, Map<String, String> environment) {
        Matcher matcher = ENV_VAR.matcher(value);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String resolved = environment.get(matcher.group(1));
            String replacement = resolved != null ? resolved : matcher.group(0);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
