package co.fanki.changeimpact;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Change Impact Engine Application.
 *
 * <p>Predicts which components of a code base are affected by a proposed
 * change, classifies the resulting risk and suggests mitigations. Runs as
 * a command line tool, or as an MCP stdio server when
 * {@code mcp.server.stdio} is set to {@code true}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class ChangeImpactApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(ChangeImpactApplication.class, args)));
    }

}
