package com.hostwatch.service;

import com.hostwatch.dto.HardwareData;
import com.hostwatch.dto.NetworkData;
import com.hostwatch.dto.PlatformData;
import com.hostwatch.dto.ProcessData;
import com.hostwatch.dto.SystemSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class SnapshotAssembler {

    public SystemSnapshot assemble(Instant timestamp,
                                   PlatformData platform,
                                   NetworkData network,
                                   HardwareData hardware,
                                   ProcessData process) {
        return new SystemSnapshot(timestamp, platform, network, hardware, process);
    }
}
