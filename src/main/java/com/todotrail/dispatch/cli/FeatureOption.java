package com.todotrail.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * The {@code --feature} option shared by every subcommand.
 */
public class FeatureOption {

    @Option(names = {"--feature", "-f"}, required = true, description = "Feature name")
    String feature;

    public String name() {
        return feature;
    }
}
