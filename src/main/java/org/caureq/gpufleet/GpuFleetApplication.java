package org.caureq.gpufleet;

import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.config.MockProviderProps;
import org.caureq.gpufleet.config.ScalewayProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AppProps.class, ScalewayProps.class, MockProviderProps.class})
public class GpuFleetApplication {

    public static void main(String[] args) {
        SpringApplication.run(GpuFleetApplication.class, args);
    }

}
