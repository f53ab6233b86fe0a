package se.ironyy_be;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IronyyBeApplication {

    public static void main(String[] args) {
        SpringApplication.run(IronyyBeApplication.class, args);
    }

}
