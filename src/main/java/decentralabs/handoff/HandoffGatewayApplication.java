package decentralabs.handoff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HandoffGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(HandoffGatewayApplication.class, args);
    }
}
