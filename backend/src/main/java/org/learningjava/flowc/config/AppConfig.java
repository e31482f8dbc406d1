package org.learningjava.flowc.config;

import org.learningjava.flowc.application.port.NativeToolchainPort;
import org.learningjava.flowc.infrastructure.adapter.out.toolchain.GppToolchainAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    //objects with external dependencies
    @Bean
    NativeToolchainPort toolchain(SandboxProperties props) {
        GppToolchainAdapter adapter = new GppToolchainAdapter(props);
        if (adapter.available()) {
            log.info("Native toolchain '{}' found, work dir {}", props.getCompiler(), props.getWorkDir());
        } else {
            log.warn("Native toolchain '{}' not found; jobs will report runtime unavailable", props.getCompiler());
        }
        return adapter;
    }
}
