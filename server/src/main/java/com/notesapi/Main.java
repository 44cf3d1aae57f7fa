package com.notesapi;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.notesapi.config.ServerConfig;
import com.notesapi.db.MongoNoteStore;
import com.notesapi.rest.RestAdapter;
import com.notesapi.rest.RestAdapterFactory;
import com.notesapi.rest.dto.GenericResponse;
import com.notesapi.util.GsonJsonMapper;
import io.javalin.Javalin;
import io.javalin.openapi.OpenApiInfo;
import io.javalin.openapi.OpenApiServer;
import io.javalin.openapi.plugin.OpenApiPlugin;
import io.javalin.openapi.plugin.redoc.ReDocPlugin;
import io.javalin.openapi.plugin.swagger.SwaggerPlugin;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import org.tinylog.Logger;

/**
 * Main server class for the Notes API.
 *
 * <p>This class is the entry point of the server. It reads the configuration, connects to
 * MongoDB, makes sure the collection's indexes exist and starts the Javalin REST server.
 *
 * <h2>Error Handling</h2>
 *
 * <p>Handlers render their own failures through {@link RestAdapter#setError}. Two fallbacks
 * cover everything else:
 *
 * <ul>
 *   <li>Unknown routes return 404 with the message "Route does not exist on the server"
 *   <li>Exceptions escaping a handler return 500 with the message "Internal server error"
 * </ul>
 *
 * <p>Both use the same {@code {"status": "fail", "message": ...}} envelope as the handlers.
 */
public class Main {

  static final String ROUTE_NOT_FOUND_MESSAGE = "Route does not exist on the server";

  private final ServerConfig config;
  private final MongoClient mongoClient;
  private final NoteServiceImpl noteServiceImpl;
  private Javalin app;

  public Main(ServerConfig config) {
    this.config = config;
    Logger.info("Configured server: {}", config.toSecureString());

    this.mongoClient = setupMongoClient(config);
    MongoNoteStore store =
        new MongoNoteStore(
            mongoClient.getDatabase(config.databaseName()), config.collectionName());
    store.ensureIndexes();

    this.noteServiceImpl =
        new NoteServiceImpl(
            new NoteServiceImpl.Config(
                store,
                config.defaultPageLimit(),
                config.maxPageLimit(),
                config.defaultSortOrder(),
                Clock.systemUTC()));
  }

  /**
   * Creates the shared MongoDB client. Every database call is bounded by the configured timeout.
   *
   * @return A client whose connection pool is shared by all requests
   */
  private static MongoClient setupMongoClient(ServerConfig config) {
    int timeout = config.mongoTimeoutMillis();
    MongoClientSettings settings =
        MongoClientSettings.builder()
            .applyConnectionString(new ConnectionString(config.mongoUri()))
            .applicationName("notes-api")
            .applyToClusterSettings(
                cluster -> cluster.serverSelectionTimeout(timeout, TimeUnit.MILLISECONDS))
            .applyToSocketSettings(
                socket ->
                    socket
                        .connectTimeout(timeout, TimeUnit.MILLISECONDS)
                        .readTimeout(timeout, TimeUnit.MILLISECONDS))
            .build();
    Logger.info("Connecting to MongoDB database {}", config.databaseName());
    return MongoClients.create(settings);
  }

  private OpenApiInfo getOpenApiInfo(OpenApiInfo openApiInfo) {
    return openApiInfo
        .title("Notes API")
        .description(
            "API for creating, listing, reading, updating and deleting notes stored in MongoDB.")
        .version("v1");
  }

  private OpenApiServer getOpenApiServer(OpenApiServer openApiServer) {
    return openApiServer
        .description("Notes REST API server endpoint")
        .url("http://localhost:{port}/")
        .variable(
            "port",
            "Server's REST port",
            String.valueOf(config.restPort()),
            String.valueOf(config.restPort()));
  }

  public void startJavalinServer() {
    RestAdapterFactory restAdapterFactory = new RestAdapterFactory(noteServiceImpl);

    // Note: redoc and swagger are available at /openapi
    app =
        Javalin.create(
            javalinConfig -> {
              javalinConfig.showJavalinBanner = false;
              javalinConfig.jsonMapper(new GsonJsonMapper());
              javalinConfig.bundledPlugins.enableCors(
                  cors ->
                      cors.addRule(
                          rule -> {
                            if (config.allowsAnyOrigin()) {
                              rule.anyHost();
                            } else {
                              for (String origin : config.corsAllowedOrigins()) {
                                rule.allowHost(origin);
                              }
                            }
                          }));
              javalinConfig.registerPlugin(
                  new OpenApiPlugin(
                      openApiConfig ->
                          openApiConfig
                              .withPrettyOutput()
                              .withDefinitionConfiguration(
                                  (version, openApiDefinition) ->
                                      openApiDefinition
                                          .withInfo(this::getOpenApiInfo)
                                          .withServer(this::getOpenApiServer))));
              javalinConfig.registerPlugin(
                  new ReDocPlugin(
                      reDocConfiguration -> reDocConfiguration.setDocumentationPath("/openapi")));
              javalinConfig.registerPlugin(
                  new SwaggerPlugin(
                      swaggerConfiguration ->
                          swaggerConfiguration.setDocumentationPath("/openapi")));

              restAdapterFactory.configureRoutes(javalinConfig.router);
            });

    app.exception(
        Exception.class,
        (e, ctx) -> {
          Logger.error(e, "Unhandled exception for {} {}", ctx.method(), ctx.path());
          ctx.attribute(RestAdapter.ERROR_RENDERED_ATTRIBUTE, Boolean.TRUE);
          ctx.status(500).json(GenericResponse.fail(RestAdapter.INTERNAL_ERROR_MESSAGE));
        });
    app.error(
        404,
        ctx -> {
          // Handlers that already rendered a NOT_FOUND keep their own message.
          if (ctx.attribute(RestAdapter.ERROR_RENDERED_ATTRIBUTE) == null) {
            ctx.json(GenericResponse.fail(ROUTE_NOT_FOUND_MESSAGE));
          }
        });

    app.start(config.restPort());
    Logger.info("REST server started, listening on port {}.", config.restPort());

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down server since JVM is shutting down");
                  try {
                    shutdown();
                  } catch (RuntimeException e) {
                    Logger.error(e, "Error during shutdown.");
                  }
                }));
  }

  private void shutdown() {
    if (app != null) {
      app.stop();
    }
    Logger.info("Closing MongoDB client");
    mongoClient.close();
  }

  public static void main(String[] args) {
    Main server = new Main(ServerConfig.fromEnvironment());
    server.startJavalinServer();
  }
}
