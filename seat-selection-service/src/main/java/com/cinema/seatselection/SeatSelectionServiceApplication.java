package com.cinema.seatselection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication
@EnableJpaRepositories(basePackages = {"com.cinema.seatselection.repository"})
@EntityScan(basePackages = {"com.cinema.common.entity"})
@EnableTransactionManagement
@EnableCaching
@EnableKafka
public class SeatSelectionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeatSelectionServiceApplication.class, args);
    }
}
