package net.kyver.relink;

import net.kyver.relink.config.EnvironmentSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    private static final String VERSION = "v1.0.0";

    public static String getVersion() {
        return VERSION;
    }

    public static void main(String[] args) {
        EnvironmentSetup.loadDotEnv();

        printStartupBanner();

        try {
            SpringApplication app = new SpringApplication(Application.class);
            app.run(args);
        } catch (Exception e) {
            logger.error("Failed to start Relink application: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        logger.info("Started Relink {} on port {}", VERSION, System.getProperty("server.port", "8080"));
        if (EnvironmentSetup.isDebugEnabled()) {
            logger.info("Debug logging is enabled");
        }
    }

    private static void printStartupBanner() {
        String BLUE = "\u001B[34m";
        String RESET = "\u001B[0m";
        String BOLD = "\u001B[1m";

        System.out.println();
        System.out.println(BLUE + "╔═══════════════════════════════════════╗" + RESET);
        System.out.println(BLUE + "║" + RESET + "  " + BOLD + "RELINK - Streaming Rewriter" + RESET + "          " + BLUE + "║" + RESET);
        System.out.println(BLUE + "║" + RESET + "  Version: " + VERSION + "                      " + BLUE + "║" + RESET);
        System.out.println(BLUE + "╚═══════════════════════════════════════╝" + RESET);
        System.out.println();
    }
}
