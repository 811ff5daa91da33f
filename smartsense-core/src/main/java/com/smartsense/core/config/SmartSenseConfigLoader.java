package com.smartsense.core.config;

import com.smartsense.api.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * smartsense.yml 加载器
 */
@Slf4j
public class SmartSenseConfigLoader {

    public static final String DEFAULT_RESOURCE = "smartsense.yml";

    public static SmartSenseConfig load(InputStream inputStream) {
        // SnakeYAML 2.x 需要显式传入 LoaderOptions
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);

        Constructor constructor = new Constructor(SmartSenseConfig.class, options);

        // 泛型 Map 的值类型需要显式声明
        TypeDescription root = new TypeDescription(SmartSenseConfig.class);
        root.addPropertyParameters("components", String.class, SmartSenseConfig.ComponentSettings.class);
        constructor.addTypeDescription(root);

        Yaml yaml = new Yaml(constructor);
        try {
            SmartSenseConfig config = yaml.load(inputStream);
            if (config == null) {
                // 空文件
                config = SmartSenseConfig.defaults();
            }
            config.validate();
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    public static SmartSenseConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            log.info("Loading configuration from {}", path.toAbsolutePath());
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file: " + path, e);
        }
    }

    /**
     * 从类路径加载，资源不存在时使用默认配置
     */
    public static SmartSenseConfig loadFromClasspath(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", resource);
                return SmartSenseConfig.defaults();
            }
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read classpath configuration: " + resource, e);
        }
    }
}
