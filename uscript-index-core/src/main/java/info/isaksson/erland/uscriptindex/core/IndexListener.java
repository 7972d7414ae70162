package info.isaksson.erland.uscriptindex.core;

import info.isaksson.erland.uscriptindex.model.SymbolTable;

/**
 * Notified when open documents should be analyzed again: after a rebuild has published a new
 * table, or when a host calls {@link UScriptIndexService#invalidate()}.
 */
@FunctionalInterface
public interface IndexListener {

    void indexChanged(SymbolTable table);
}
