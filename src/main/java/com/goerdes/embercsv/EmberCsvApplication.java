package com.goerdes.embercsv;

import com.goerdes.embercsv.api.ConversionRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class EmberCsvApplication {

    public static void main(String[] args) {
        WebApplicationType type = webApplicationType(args);
        SpringApplication application = new SpringApplication(EmberCsvApplication.class);
        application.setWebApplicationType(type);
        ConfigurableApplicationContext context = application.run(args);

        // command line conversions are done once the runners have returned
        if (type == WebApplicationType.NONE) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * Runs without the servlet server when files are passed with {@code --input}.
     */
    static WebApplicationType webApplicationType(String... args) {
        return new DefaultApplicationArguments(args).containsOption(ConversionRunner.INPUT_OPTION)
                ? WebApplicationType.NONE
                : WebApplicationType.SERVLET;
    }

}
