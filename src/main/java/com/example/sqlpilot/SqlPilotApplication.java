package com.example.sqlpilot;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import com.example.sqlpilot.cli.CliCommandRunner;

@SpringBootApplication
public class SqlPilotApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(SqlPilotApplication.class);
        if (CliCommandRunner.isCliInvocation(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            application.setBannerMode(Banner.Mode.OFF);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }
}
