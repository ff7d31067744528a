package org.example.driver_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DriverLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriverLedgerApplication.class, args);
    }
}
