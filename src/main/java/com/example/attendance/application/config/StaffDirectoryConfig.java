package com.example.attendance.application.config;

import com.example.attendance.application.service.StaffDirectory;
import com.example.attendance.infrastructure.roster.CsvStaffRosterStore;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(AttendanceProperties.class)
public class StaffDirectoryConfig {

    @Bean
    public StaffDirectory staffDirectory(AttendanceProperties properties, CsvStaffRosterStore store) {
        Path rosterPath = Path.of(properties.rosterPath());
        StaffDirectory directory = new StaffDirectory(store, rosterPath);
        directory.load(rosterPath);
        return directory;
    }
}
