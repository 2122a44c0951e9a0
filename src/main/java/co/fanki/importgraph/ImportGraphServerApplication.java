package co.fanki.importgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Import Graph MCP Server Application.
 *
 * <p>Main entry point of the server that analyzes the import graph of
 * JavaScript and TypeScript source trees and exposes cycles, blast radius,
 * dead exports and coupling over REST and as Model Context Protocol (MCP)
 * tools.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class ImportGraphServerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(ImportGraphServerApplication.class, args);
    }

}
