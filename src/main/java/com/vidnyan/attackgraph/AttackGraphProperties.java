package com.vidnyan.attackgraph;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for attack graph generation.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "atg")
public class AttackGraphProperties {

    /**
     * Create the attackers declared in the model and compromise their entry points.
     */
    private boolean attachAttackers = true;

    /**
     * Compute reachability after attackers are attached.
     */
    private boolean calculateReachability = true;

    private Generate generate = new Generate();

    @Data
    public static class Generate {
        /**
         * Compiled language specification, .json or .mar.
         */
        private String language;

        /**
         * Instance model, .json, .yml or .yaml.
         */
        private String model;

        /**
         * Where to write the graph. The extension selects JSON or YAML; empty skips saving.
         */
        private String output;
    }
}
