package com.phillippitts.speakruntime.service.memory;

import com.phillippitts.speakruntime.config.properties.MemoryMonitorProperties.Source;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;

/**
 * {@link MemorySampler} backed by the platform MXBeans.
 *
 * <p>{@link Source#HEAP} measures the heap against its maximum (committed size when no maximum
 * is set). {@link Source#SYSTEM} measures physical memory through the OS bean and falls back
 * to the heap when the JVM does not expose it. The app figure is always heap plus non-heap used.
 */
public class JvmMemorySampler implements MemorySampler {

    private static final Logger LOG = LogManager.getLogger(JvmMemorySampler.class);

    private final Source source;
    private final MemoryMXBean memoryBean;
    private final OperatingSystemMXBean osBean;

    public JvmMemorySampler(Source source) {
        this(source, ManagementFactory.getMemoryMXBean(), ManagementFactory.getOperatingSystemMXBean());
    }

    JvmMemorySampler(Source source, MemoryMXBean memoryBean, OperatingSystemMXBean osBean) {
        this.source = source == null ? Source.HEAP : source;
        this.memoryBean = memoryBean;
        this.osBean = osBean;
    }

    @Override
    public MemoryReading sample() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        MemoryUsage nonHeap = memoryBean.getNonHeapMemoryUsage();
        long appBytes = Math.max(0L, heap.getUsed()) + Math.max(0L, nonHeap.getUsed());

        if (source == Source.SYSTEM && osBean instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            long total = sunOs.getTotalMemorySize();
            long free = sunOs.getFreeMemorySize();
            if (total > 0) {
                return new MemoryReading(total, Math.max(0L, total - free), appBytes);
            }
            LOG.debug("OS bean reported no physical memory size, using heap");
        }

        long total = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        return new MemoryReading(Math.max(0L, total), Math.max(0L, heap.getUsed()), appBytes);
    }

    public Source getSource() {
        return source;
    }
}
