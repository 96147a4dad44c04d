package pmc.domain.orchestration;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.dal.ServerConfig;

import java.lang.reflect.Type;

/**
 * Manages the local status web server (Javalin) lifecycle
 * @author Martin Sustik <sustik@herman.cz>
 * @since 17/10/2026
 */
public class WebServerManager {
    private static final Logger logger = LoggerFactory.getLogger(WebServerManager.class);

    private final ServerConfig serverConfig;
    private final FleetApiController apiController;
    private final Gson gson;

    private Javalin javalinApp;

    public WebServerManager(ServerConfig serverConfig, FleetApiController apiController, Gson gson) {
        this.serverConfig = serverConfig;
        this.apiController = apiController;
        this.gson = gson;
    }

    public void start() {
        logger.info("Starting web server on {}:{}...", serverConfig.host(), serverConfig.port());
        javalinApp = createJavalinApp();
        logger.info("✓ Web server started successfully");
    }

    public void stop() {
        if (javalinApp != null) {
            javalinApp.stop();
            javalinApp = null;
        }
    }

    private Javalin createJavalinApp() {
        Javalin app = Javalin.create(config -> {
            config.jsonMapper(createGsonMapper());
            config.router.apiBuilder(apiController::registerRoutes);
        });

        app.exception(Exception.class, (exception, ctx) -> {
            logger.error("Unhandled exception", exception);
            ctx.status(500).json(ApiResponse.error("Internal server error: " + exception.getMessage()));
        });

        return app.start(serverConfig.host(), serverConfig.port());
    }

    private JsonMapper createGsonMapper() {
        return new JsonMapper() {
            @Override
            public String toJsonString(Object obj, Type type) {
                return gson.toJson(obj, type);
            }

            @Override
            public <T> T fromJsonString(String json, Type targetType) {
                return gson.fromJson(json, targetType);
            }
        };
    }
}
