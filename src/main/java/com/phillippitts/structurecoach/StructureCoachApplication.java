package com.phillippitts.structurecoach;

import com.phillippitts.structurecoach.config.properties.AnalysisProperties;
import com.phillippitts.structurecoach.config.properties.QualityProperties;
import com.phillippitts.structurecoach.config.properties.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AnalysisProperties.class,
        QualityProperties.class,
        TranscriptionProperties.class
})
public class StructureCoachApplication {

    public static void main(String[] args) {
        SpringApplication.run(StructureCoachApplication.class, args);
    }

}
