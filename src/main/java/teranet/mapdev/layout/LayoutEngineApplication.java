package teranet.mapdev.layout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Layout engine command-line application.
 * <p>
 * Usage: {@code layout-engine <detect|validate|parse|tcl|xsl> <file>... [--out=<file>]}
 */
@SpringBootApplication
public class LayoutEngineApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(LayoutEngineApplication.class, args)));
    }
}
