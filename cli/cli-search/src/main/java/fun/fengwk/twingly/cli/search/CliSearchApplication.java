package fun.fengwk.twingly.cli.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.twingly")
public class CliSearchApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(CliSearchApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.run(args);
    }

}
