package com.hostwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import oshi.SystemInfo;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.software.os.OperatingSystem;

import java.time.Clock;

/**
 * Host query entry points shared by the collectors.
 */
@Configuration
public class OshiConfig {

    @Bean
    public SystemInfo systemInfo() {
        return new SystemInfo();
    }

    @Bean
    public OperatingSystem operatingSystem(SystemInfo systemInfo) {
        return systemInfo.getOperatingSystem();
    }

    @Bean
    public HardwareAbstractionLayer hardwareAbstractionLayer(SystemInfo systemInfo) {
        return systemInfo.getHardware();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
