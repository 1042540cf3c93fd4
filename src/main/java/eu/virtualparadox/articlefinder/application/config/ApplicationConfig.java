package eu.virtualparadox.articlefinder.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "articlefinder")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path corpus;
    private Path models;

    /**
     * Role to the roles it implies, e.g. {@code articlefinder.role-hierarchy.admin=legal,staff,public}.
     * Empty means the built-in hierarchy.
     */
    private Map<String, List<String>> roleHierarchy = new LinkedHashMap<>();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (models != null) Files.createDirectories(models);
    }
}
