package com.todotrail.core.persistence;

import com.todotrail.core.config.TodoTrailProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of feature workspaces under the storage root. One instance per feature,
 * so every component shares the same feature mutex.
 */
@Component
public class FeatureWorkspaces {

    private static final Logger log = LoggerFactory.getLogger(FeatureWorkspaces.class);

    private final Path root;
    private final ConcurrentHashMap<String, FeatureWorkspace> workspaces = new ConcurrentHashMap<>();

    @Autowired
    public FeatureWorkspaces(TodoTrailProperties properties) {
        this(Path.of(properties.getStorage().getRoot()));
    }

    public FeatureWorkspaces(Path root) {
        this.root = root;
        log.info("Feature workspaces rooted at {}", root.toAbsolutePath());
    }

    public FeatureWorkspace get(String feature) {
        return workspaces.computeIfAbsent(feature, f -> new FeatureWorkspace(root, f));
    }

    public Path root() {
        return root;
    }
}
