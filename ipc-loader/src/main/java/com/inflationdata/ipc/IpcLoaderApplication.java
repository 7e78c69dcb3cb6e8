package com.inflationdata.ipc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties
public class IpcLoaderApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(IpcLoaderApplication.class, args);

        boolean exitAfterRun = context.getEnvironment()
                .getProperty("ipc-loader.run.exit-after-run", Boolean.class, true);
        if (exitAfterRun) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
