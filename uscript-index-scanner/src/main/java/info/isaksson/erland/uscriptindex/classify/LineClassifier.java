package info.isaksson.erland.uscriptindex.classify;

import info.isaksson.erland.uscriptindex.model.DeclarationMatch;

import java.util.Optional;

/**
 * Classifies a single source line as at most one declaration.
 *
 * <p>Implementations are stateless and safe to share. An empty result means the line is not a
 * declaration; it is not an error.</p>
 */
public interface LineClassifier {

    Optional<DeclarationMatch> classify(String line);
}
