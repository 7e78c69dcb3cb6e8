package com.inflationdata.ipc.config;

import com.inflationdata.ipc.exception.IpcLoadException;
import com.inflationdata.ipc.service.NatureDeriver;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

@Configuration
public class IpcLoaderConfig {

    /**
     * Every source fetch is bounded by these timeouts so a stalled endpoint fails the run
     * instead of hanging it.
     */
    @Bean
    public RestTemplate ipcRestTemplate(RestTemplateBuilder builder, IpcLoaderProperties properties) {
        return builder
                .setConnectTimeout(properties.getHttp().getConnectTimeout())
                .setReadTimeout(properties.getHttp().getReadTimeout())
                .build();
    }

    @Bean
    public NatureDeriver natureDeriver(ResourceLoader resourceLoader, IpcLoaderProperties properties) {
        Resource table = resourceLoader.getResource(properties.getNatureTable());
        try (Reader reader = new InputStreamReader(table.getInputStream(), StandardCharsets.UTF_8)) {
            return NatureDeriver.fromCsv(reader);
        } catch (IOException e) {
            throw new IpcLoadException("Cannot open nature table " + properties.getNatureTable(), e);
        }
    }
}
