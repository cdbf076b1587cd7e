package com.hydrokb.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String OPENAI_KEY_ENV = "HYDROKB_OPENAI_API_KEY";
    static final String OLLAMA_URL_ENV = "HYDROKB_OLLAMA_URL";

    private ConfigLoader() {
    }

    public static AppConfig load(Path config) throws IOException {
        return load(config, System.getenv());
    }

    static AppConfig load(Path config, Map<String, String> environment) throws IOException {
        AppConfig loaded;
        if (!Files.exists(config)) {
            log.info("config.defaults path={} reason=missing", config);
            loaded = new AppConfig();
        } else {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            loaded = mapper.readValue(config.toFile(), AppConfig.class);
        }
        applyEnvironment(loaded, environment);
        return loaded;
    }

    private static void applyEnvironment(AppConfig config, Map<String, String> environment) {
        String apiKey = environment.get(OPENAI_KEY_ENV);
        if (apiKey != null && !apiKey.isBlank()) {
            config.getEmbedding().getOpenai().setApiKey(apiKey);
        }
        String ollamaUrl = environment.get(OLLAMA_URL_ENV);
        if (ollamaUrl != null && !ollamaUrl.isBlank()) {
            config.getEmbedding().getOllama().setBaseUrl(ollamaUrl);
        }
    }
}
