package io.github.jakubt4.transitfinder.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.orekit.data.DataContext;
import org.orekit.data.DirectoryCrawler;
import org.orekit.data.ZipJarCrawler;
import org.orekit.time.TimeScale;
import org.orekit.time.TimeScalesFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;

/**
 * Bootstraps the Orekit astrodynamics library by registering its data set (Earth orientation
 * parameters, leap seconds, JPL DE ephemerides) with Orekit's {@link DataContext}.
 *
 * <p>{@code orekit.data.location} is either a classpath resource ({@code classpath:orekit-data.zip},
 * the default) or a filesystem directory. Other beans that depend on Orekit should inject this
 * configuration to guarantee ordering.
 */
@Slf4j
@Configuration
public class OrekitConfig {

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final String dataLocation;

    public OrekitConfig(@Value("${orekit.data.location:classpath:orekit-data.zip}") final String dataLocation) {
        this.dataLocation = dataLocation;
    }

    /**
     * @throws IllegalStateException if the data set cannot be found
     */
    @PostConstruct
    public void init() {
        final var manager = DataContext.getDefault().getDataProvidersManager();
        if (dataLocation.startsWith(CLASSPATH_PREFIX)) {
            final var resource = dataLocation.substring(CLASSPATH_PREFIX.length());
            final var orekitData = OrekitConfig.class.getClassLoader().getResource(resource);
            if (orekitData == null) {
                throw new IllegalStateException(resource + " not found on classpath");
            }
            manager.addProvider(new ZipJarCrawler(orekitData));
        } else {
            final var directory = new File(dataLocation);
            if (!directory.isDirectory()) {
                throw new IllegalStateException("Orekit data directory " + dataLocation + " does not exist");
            }
            manager.addProvider(new DirectoryCrawler(directory));
        }
        log.info("Orekit data loaded from {}", dataLocation);
    }

    /**
     * UTC as defined by the loaded leap-second history; TLE epochs are read in it.
     */
    @Bean
    public TimeScale utc() {
        return TimeScalesFactory.getUTC();
    }
}
