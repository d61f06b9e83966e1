package com.project.sketch.scoring.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Maps /uploads/** and /generated-images/** to the configured directories, independent of the
 * working directory.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    // same settings as StorageService and ReferenceImageLocator
    @Value("${app.upload.dir:uploads}")
    private String uploadDir;

    @Value("${app.reference.dir:generated-images}")
    private String referenceDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations(location(uploadDir));
        registry.addResourceHandler("/generated-images/**")
                .addResourceLocations(location(referenceDir));
    }

    private static String location(String dir) {
        Path abs = Paths.get(dir).toAbsolutePath().normalize();
        return "file:" + abs + "/";
    }
}
