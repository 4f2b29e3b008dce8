package hipstershop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CartServiceApplication {

    private static final Logger logger = LoggerFactory.getLogger(CartServiceApplication.class);

    public static void main(String[] args) {
        logger.info("Starting CartService...");
        SpringApplication.run(CartServiceApplication.class, args);
    }
}
