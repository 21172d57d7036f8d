// Namespace
package com.gnovoa.cricket;

// Imports
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.runner.RunnerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties({SimProperties.class, RunnerProperties.class})
public class VirtuaCricketApplication {

  public static void main(String[] args) {
    SpringApplication.run(VirtuaCricketApplication.class, args);
  }
}
