package quest.progression;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProgressionApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProgressionApplication.class, args);
  }
}
