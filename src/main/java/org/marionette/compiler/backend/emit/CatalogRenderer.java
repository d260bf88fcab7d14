package org.marionette.compiler.backend.emit;

import org.marionette.compiler.api.Catalog;

/**
 * Renders a compiled {@link Catalog} as text.
 */
public interface CatalogRenderer {

    /**
     * @param catalog The catalog to render.
     * @return The rendered text, ending with a line break.
     */
    String render(Catalog catalog);
}
