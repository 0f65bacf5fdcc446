package org.dxworks.mdtree;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.mdtree.markup.CommonmarkReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MdtreeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "mdtree-config.yml";
    private static final String DEFAULT_MATH_FENCE_INFO = CommonmarkReader.DEFAULT_MATH_FENCE_INFO;

    private final int maxFileLines;
    private final String mathFenceInfo;

    private MdtreeConfig(int maxFileLines, String mathFenceInfo) {
        this.maxFileLines = maxFileLines;
        this.mathFenceInfo = mathFenceInfo;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /**
     * Info string marking a fenced code block as display math. Empty disables the rule.
     */
    public String getMathFenceInfo() {
        return mathFenceInfo;
    }

    public static MdtreeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MdtreeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                String effectiveMathFenceInfo = yamlConfig.mathFenceInfo != null
                        ? yamlConfig.mathFenceInfo.trim()
                        : DEFAULT_MATH_FENCE_INFO;
                return new MdtreeConfig(effectiveMaxFileLines, effectiveMathFenceInfo);
            }
        } catch (IOException e) {
            System.err.println("Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static MdtreeConfig defaults() {
        return new MdtreeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_MATH_FENCE_INFO);
    }

    public static MdtreeConfig with(int maxFileLines, String mathFenceInfo) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new MdtreeConfig(effectiveMaxFileLines, mathFenceInfo == null ? DEFAULT_MATH_FENCE_INFO : mathFenceInfo);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String mathFenceInfo;
    }
}
