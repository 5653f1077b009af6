package com.phillippitts.wfmparity;

import com.phillippitts.wfmparity.config.properties.AccuracyProperties;
import com.phillippitts.wfmparity.config.properties.ComparisonProperties;
import com.phillippitts.wfmparity.config.properties.MaintenanceProperties;
import com.phillippitts.wfmparity.config.properties.MiningProperties;
import com.phillippitts.wfmparity.config.properties.QueueProperties;
import com.phillippitts.wfmparity.config.properties.WorkerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        QueueProperties.class,
        ComparisonProperties.class,
        AccuracyProperties.class,
        MiningProperties.class,
        MaintenanceProperties.class,
        WorkerProperties.class
})
@EnableScheduling
public class WfmParityApplication {

    public static void main(String[] args) {
        SpringApplication.run(WfmParityApplication.class, args);
    }

}
