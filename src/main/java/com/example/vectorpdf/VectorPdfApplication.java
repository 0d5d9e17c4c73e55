package com.example.vectorpdf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point.
 * This class only wires the application context and hands control to Spring; the generator itself lives
 * under the application and domain layers and can be used without the web layer.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class VectorPdfApplication {

	/**
	 * Boots the Spring container and exposes the HTTP endpoints defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(VectorPdfApplication.class, args);
	}

}
