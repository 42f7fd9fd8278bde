package app.signaltrust.keys;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class KeysApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(KeysApplication.class, args)));
	}

}
