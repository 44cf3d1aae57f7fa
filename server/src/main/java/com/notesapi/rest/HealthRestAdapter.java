package com.notesapi.rest;

import static io.javalin.apibuilder.ApiBuilder.get;

import com.notesapi.rest.dto.GenericResponse;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiResponse;

/** REST adapter for the liveness endpoint. It does not contact the database. */
public class HealthRestAdapter implements RestAdapter {

  static final String HEALTHY_MESSAGE = "Notes API is up";

  @Override
  public void registerRoutes() {
    get("/api/healthchecker", this::handleHealthCheck);
  }

  @OpenApi(
      path = "/api/healthchecker",
      methods = {HttpMethod.GET},
      summary = "Health check",
      description = "Reports that the server is accepting requests.",
      operationId = "healthCheck",
      tags = "Health",
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The server is up",
            content = @OpenApiContent(from = GenericResponse.class))
      })
  public void handleHealthCheck(Context ctx) {
    ctx.json(GenericResponse.success(HEALTHY_MESSAGE));
  }
}
