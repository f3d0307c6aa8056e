package com.dental.clinic.console;

import com.dental.clinic.config.ClinicCatalog;
import com.dental.clinic.service.ClinicDeskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

@Component
@ConditionalOnProperty(name = "clinic.console.enabled", havingValue = "true")
public class ClinicConsole implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ClinicConsole.class);

    private final ClinicDeskService desk;
    private final ClinicCatalog catalog;

    public ClinicConsole(ClinicDeskService desk, ClinicCatalog catalog) {
        this.desk = desk;
        this.catalog = catalog;
    }

    @Override
    public void run(String... args) {
        log.info("Starting records console");
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        new ConsoleSession(desk, catalog, in, out).run();
        log.info("Records console closed");
    }
}
