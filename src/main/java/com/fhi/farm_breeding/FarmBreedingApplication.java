package com.fhi.farm_breeding;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@SpringBootApplication
public class FarmBreedingApplication
{
    /**
     * $ mvn spring-boot:run
     */
    public static void main(String[] args)
    {
        SpringApplication.run(FarmBreedingApplication.class, args);
        log.info("Farm breeding service started");
    }
}
