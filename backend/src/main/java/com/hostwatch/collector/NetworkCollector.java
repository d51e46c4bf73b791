package com.hostwatch.collector;

import com.hostwatch.dto.NetworkAddress;
import com.hostwatch.dto.NetworkData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.hardware.NetworkIF;
import oshi.software.os.OperatingSystem;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class NetworkCollector {

    private static final Logger log = LoggerFactory.getLogger(NetworkCollector.class);

    /**
     * Resolves a host name to its addresses.
     */
    @FunctionalInterface
    public interface AddressResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final OperatingSystem os;
    private final HardwareAbstractionLayer hardware;
    private final AddressResolver resolver;

    // generated at most once per process when no interface has a hardware address
    private volatile Long randomNode;

    @Autowired
    public NetworkCollector(OperatingSystem os, HardwareAbstractionLayer hardware) {
        this(os, hardware, InetAddress::getAllByName);
    }

    public NetworkCollector(OperatingSystem os, HardwareAbstractionLayer hardware, AddressResolver resolver) {
        this.os = os;
        this.hardware = hardware;
        this.resolver = resolver;
    }

    public NetworkData collect() throws CollectorException {
        String hostname;
        List<NetworkIF> interfaces;
        try {
            hostname = os.getNetworkParams().getHostName();
            interfaces = hardware.getNetworkIFs(true);
        } catch (RuntimeException e) {
            throw new CollectorException(Category.NETWORK, "Network query failed: " + e.getMessage(), e);
        }
        if (hostname == null || hostname.isBlank()) {
            throw new CollectorException(Category.NETWORK, "Host name could not be determined");
        }

        String ipAddress = resolvePrimaryAddress(hostname);
        String macAddress = MacAddresses.format(nodeId(interfaces));

        return new NetworkData(hostname, ipAddress, macAddress, describeInterfaces(interfaces));
    }

    private String resolvePrimaryAddress(String hostname) throws CollectorException {
        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(hostname);
        } catch (UnknownHostException e) {
            throw new CollectorException(Category.NETWORK, "Cannot resolve host name " + hostname, e);
        }
        if (addresses == null || addresses.length == 0) {
            throw new CollectorException(Category.NETWORK, "No address for host name " + hostname);
        }
        for (InetAddress address : addresses) {
            if (address instanceof Inet4Address) {
                return address.getHostAddress();
            }
        }
        return addresses[0].getHostAddress();
    }

    private long nodeId(List<NetworkIF> interfaces) {
        for (NetworkIF nif : interfaces) {
            try {
                long node = MacAddresses.parse(nif.getMacaddr());
                if (node != 0L) {
                    return node;
                }
            } catch (RuntimeException e) {
                log.debug("Skipping interface while looking up node id: {}", e.getMessage());
            }
        }
        Long node = randomNode;
        if (node == null) {
            synchronized (this) {
                if (randomNode == null) {
                    randomNode = (new SecureRandom().nextLong() & MacAddresses.NODE_MASK) | MacAddresses.MULTICAST_BIT;
                    log.info("No hardware address found, using random node id");
                }
                node = randomNode;
            }
        }
        return node;
    }

    private Map<String, List<NetworkAddress>> describeInterfaces(List<NetworkIF> interfaces) {
        Map<String, List<NetworkAddress>> result = new LinkedHashMap<>();
        for (NetworkIF nif : interfaces) {
            try {
                String name = nif.getName();
                if (name == null || name.isBlank()) {
                    log.debug("Skipping interface without a name");
                    continue;
                }
                result.put(name, addressesOf(nif));
            } catch (RuntimeException e) {
                log.debug("Skipping unreadable network interface: {}", e.getMessage());
            }
        }
        return result;
    }

    private static List<NetworkAddress> addressesOf(NetworkIF nif) {
        List<NetworkAddress> addresses = new ArrayList<>();

        String[] ipv4 = nif.getIPv4addr();
        Short[] masks = nif.getSubnetMasks();
        for (int i = 0; ipv4 != null && i < ipv4.length; i++) {
            Short prefix = masks != null && i < masks.length ? masks[i] : null;
            addresses.add(new NetworkAddress(ipv4[i], Netmasks.ipv4(prefix), NetworkAddress.AF_INET));
        }

        String[] ipv6 = nif.getIPv6addr();
        Short[] prefixes = nif.getPrefixLengths();
        for (int i = 0; ipv6 != null && i < ipv6.length; i++) {
            Short prefix = prefixes != null && i < prefixes.length ? prefixes[i] : null;
            addresses.add(new NetworkAddress(ipv6[i], Netmasks.ipv6(prefix), NetworkAddress.AF_INET6));
        }

        String mac = nif.getMacaddr();
        if (mac != null && !mac.isBlank()) {
            addresses.add(new NetworkAddress(mac.toLowerCase(), null, NetworkAddress.AF_LINK));
        }
        return addresses;
    }
}
