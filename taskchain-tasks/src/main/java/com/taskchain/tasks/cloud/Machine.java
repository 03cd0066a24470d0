package com.taskchain.tasks.cloud;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A machine as reported by a cloud provider.
 */
public record Machine(
    String id,
    String name,
    String state,
    List<String> publicIps,
    List<String> privateIps,
    Map<String, Object> extra
) {
    public Machine {
        publicIps = publicIps == null ? List.of() : List.copyOf(publicIps);
        privateIps = privateIps == null ? List.of() : List.copyOf(privateIps);
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * Public addresses without IPv6 ones.
     */
    public List<String> publicIpv4s() {
        return publicIps.stream().filter(ip -> !ip.contains(":")).toList();
    }
}
