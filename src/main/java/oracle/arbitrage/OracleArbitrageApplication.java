package oracle.arbitrage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OracleArbitrageApplication {

    public static void main(String[] args) {
        SpringApplication.run(OracleArbitrageApplication.class, args);
    }
}
