package com.hostwatch.collector;

import com.hostwatch.dto.PlatformData;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.software.os.OperatingSystem;

import java.util.Locale;

/**
 * {@code system} is the kernel family ("Linux", "Windows", "Darwin") and {@code release} the
 * kernel release. Distribution name, version and code name go into {@code version}.
 */
@Component
public class PlatformCollector {

    private final OperatingSystem os;
    private final HardwareAbstractionLayer hardware;
    private final String osName;
    private final String osVersion;

    @Autowired
    public PlatformCollector(OperatingSystem os, HardwareAbstractionLayer hardware) {
        this(os, hardware, System.getProperty("os.name", ""), System.getProperty("os.version", ""));
    }

    PlatformCollector(OperatingSystem os, HardwareAbstractionLayer hardware, String osName, String osVersion) {
        this.os = os;
        this.hardware = hardware;
        this.osName = osName;
        this.osVersion = osVersion;
    }

    public PlatformData collect() throws CollectorException {
        try {
            OperatingSystem.OSVersionInfo versionInfo = os.getVersionInfo();
            String system = systemName(osName);
            return new PlatformData(
                system,
                osVersion,
                describeVersion(os.getFamily(), versionInfo),
                System.getProperty("os.arch", ""),
                hardware.getProcessor().getProcessorIdentifier().getIdentifier(),
                new PlatformData.Architecture(os.getBitness() + "bit", linkageFor(system)),
                Runtime.version().toString()
            );
        } catch (RuntimeException e) {
            throw new CollectorException(Category.PLATFORM, "Platform query failed: " + e.getMessage(), e);
        }
    }

    // e.g. "Ubuntu 22.04.3 LTS (Jammy Jellyfish)"
    private static String describeVersion(String family, OperatingSystem.OSVersionInfo info) {
        StringBuilder sb = new StringBuilder();
        if (family != null && !family.isBlank()) {
            sb.append(family);
        }
        if (info.getVersion() != null && !info.getVersion().isBlank()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(info.getVersion());
        }
        if (info.getCodeName() != null && !info.getCodeName().isBlank()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append('(').append(info.getCodeName()).append(')');
        }
        return sb.toString();
    }

    /**
     * Reduces the JVM's {@code os.name} to its kernel family: "Windows 11" becomes "Windows",
     * "Mac OS X" becomes "Darwin". Anything else is returned unchanged.
     */
    static String systemName(String osName) {
        if (osName == null) return "";
        String n = osName.toLowerCase(Locale.ROOT);
        if (n.startsWith("windows")) return "Windows";
        if (n.startsWith("mac") || n.startsWith("darwin")) return "Darwin";
        return osName;
    }

    static String linkageFor(String system) {
        if (system == null || system.isEmpty()) return "";
        if (system.equals("Windows")) return "WindowsPE";
        if (system.equals("Darwin")) return "Mach-O";
        return "ELF";
    }
}
