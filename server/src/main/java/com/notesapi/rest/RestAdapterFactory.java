package com.notesapi.rest;

import com.google.common.collect.ImmutableList;
import com.notesapi.NoteServiceImpl;
import io.javalin.config.RouterConfig;
import java.util.List;

/**
 * Factory for creating the REST adapters of the server.
 *
 * <p>This factory creates and owns all REST adapter instances and registers their routes with the
 * Javalin router.
 */
public class RestAdapterFactory {

  private final List<RestAdapter> adapters;

  /**
   * Creates a new RestAdapterFactory.
   *
   * @param noteService The service backing the note endpoints
   */
  public RestAdapterFactory(NoteServiceImpl noteService) {
    this.adapters =
        ImmutableList.of(new HealthRestAdapter(), new NoteServiceRestAdapter(noteService));
  }

  /** Configures the Javalin router to use the REST adapters. */
  public void configureRoutes(RouterConfig router) {
    router.apiBuilder(() -> adapters.forEach(RestAdapter::registerRoutes));
  }
}
