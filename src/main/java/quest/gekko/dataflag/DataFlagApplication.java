package quest.gekko.dataflag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DataFlagApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataFlagApplication.class, args);
    }

}
