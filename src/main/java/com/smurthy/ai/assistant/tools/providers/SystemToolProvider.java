package com.smurthy.ai.assistant.tools.providers;

import com.smurthy.ai.assistant.tools.ToolBinding;
import com.smurthy.ai.assistant.tools.ToolCategory;
import com.smurthy.ai.assistant.tools.ToolExecutionException;
import com.smurthy.ai.assistant.tools.ToolMetadata;
import com.smurthy.ai.assistant.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetAddress;
import java.net.InterfaceAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Local machine information: hardware, processes, network and the current time.
 */
@Component
public class SystemToolProvider implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(SystemToolProvider.class);

    private static final long MB = 1024L * 1024L;
    private static final long GB = MB * 1024L;
    private static final int TOP_PROCESSES = 10;
    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy, hh:mm a (zzz)", Locale.ENGLISH);

    private final Clock clock;

    public SystemToolProvider() {
        this(Clock.systemDefaultZone());
    }

    public SystemToolProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<ToolBinding> getTools() {
        return List.of(
                new ToolBinding(ToolMetadata.builder("get_system_info", ToolCategory.SYSTEM_INFO)
                        .description("Report operating system, CPU, memory and disk usage of this computer")
                        .keywords("system", "info", "cpu", "memory", "ram", "disk", "hardware", "specs", "performance")
                        .priority(9)
                        .minConfidence(0.2)
                        .estimatedCost(0.5)
                        .build(), query -> systemInfo()),
                new ToolBinding(ToolMetadata.builder("get_running_processes", ToolCategory.SYSTEM_INFO)
                        .description("List the processes using the most CPU time")
                        .keywords("process", "processes", "running", "task manager", "apps running")
                        .priority(7)
                        .minConfidence(0.2)
                        .estimatedCost(1.0)
                        .build(), query -> runningProcesses()),
                new ToolBinding(ToolMetadata.builder("get_network_info", ToolCategory.SYSTEM_INFO)
                        .description("Show host name and the addresses of active network interfaces")
                        .keywords("network", "ip", "wifi", "internet", "interface", "connection")
                        .priority(8)
                        .minConfidence(0.2)
                        .estimatedCost(0.5)
                        .build(), query -> networkInfo()),
                new ToolBinding(ToolMetadata.builder("get_current_datetime", ToolCategory.UTILITIES)
                        .description("Tell the current date and time")
                        .keywords("time", "date", "today", "day", "clock")
                        .priority(8)
                        .minConfidence(0.2)
                        .estimatedCost(0.1)
                        .asyncCapable(false)
                        .build(), query -> currentDateTime())
        );
    }

    String systemInfo() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        Runtime runtime = Runtime.getRuntime();
        StringBuilder sb = new StringBuilder("System Information:\n");
        sb.append(String.format("- OS: %s %s (%s)%n", os.getName(), os.getVersion(), os.getArch()));
        sb.append(String.format("- CPU cores: %d%n", os.getAvailableProcessors()));
        if (os.getSystemLoadAverage() >= 0) {
            sb.append(String.format("- Load average: %.2f%n", os.getSystemLoadAverage()));
        }
        if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
            long total = extended.getTotalMemorySize();
            long free = extended.getFreeMemorySize();
            sb.append(String.format("- Memory: %.1f GB used of %.1f GB%n",
                    (total - free) / (double) GB, total / (double) GB));
        }
        sb.append(String.format("- JVM heap: %d MB used of %d MB max%n",
                (runtime.totalMemory() - runtime.freeMemory()) / MB, runtime.maxMemory() / MB));
        for (File root : File.listRoots()) {
            long total = root.getTotalSpace();
            if (total > 0) {
                sb.append(String.format("- Disk %s: %.1f GB free of %.1f GB%n",
                        root.getPath(), root.getUsableSpace() / (double) GB, total / (double) GB));
            }
        }
        return sb.toString().trim();
    }

    String runningProcesses() {
        List<ProcessHandle> top = ProcessHandle.allProcesses()
                .filter(p -> p.info().totalCpuDuration().isPresent())
                .sorted(Comparator.comparing(
                        (ProcessHandle p) -> p.info().totalCpuDuration().orElse(Duration.ZERO)).reversed())
                .limit(TOP_PROCESSES)
                .toList();
        if (top.isEmpty()) {
            return "No process information available.";
        }
        StringBuilder sb = new StringBuilder("Top processes by CPU time:\n");
        for (ProcessHandle process : top) {
            String command = process.info().command().orElse("unknown");
            String name = command.substring(command.lastIndexOf(File.separatorChar) + 1);
            sb.append(String.format("- %s (pid %d): %ds CPU%n", name, process.pid(),
                    process.info().totalCpuDuration().orElse(Duration.ZERO).toSeconds()));
        }
        return sb.toString().trim();
    }

    String networkInfo() {
        StringBuilder sb = new StringBuilder("Network Information:\n");
        try {
            InetAddress local = InetAddress.getLocalHost();
            sb.append(String.format("- Host: %s (%s)%n", local.getHostName(), local.getHostAddress()));
        } catch (UnknownHostException e) {
            log.debug("Local host name not resolvable: {}", e.getMessage());
            sb.append("- Host: unknown\n");
        }
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nic.isUp() || nic.isLoopback()) {
                    continue;
                }
                List<String> addresses = nic.getInterfaceAddresses().stream()
                        .map(InterfaceAddress::getAddress)
                        .map(InetAddress::getHostAddress)
                        .toList();
                sb.append(String.format("- %s: %s%n", nic.getDisplayName(), String.join(", ", addresses)));
            }
        } catch (SocketException e) {
            throw new ToolExecutionException("Unable to read network interfaces", e);
        }
        return sb.toString().trim();
    }

    String currentDateTime() {
        return "It is " + ZonedDateTime.now(clock).format(DATE_TIME) + ".";
    }
}
