package uk.curriculum.triplestore.sparql;

import org.apache.commons.lang3.StringUtils;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryException;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.update.UpdateFactory;
import org.apache.jena.update.UpdateRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static java.util.Optional.ofNullable;

/**
 * Parses protocol operations. Blank input yields an empty optional, invalid input an
 * {@link IllegalArgumentException} carrying the parser message.
 */
public interface QueryParserUtil {
  Logger LOGGER = LoggerFactory.getLogger(QueryParserUtil.class);

  static Optional<Query> parseQuery(String query) {
    return ofNullable(query).filter(StringUtils::isNotBlank).map(q -> {
      try {
        return QueryFactory.create(q);
      }
      catch (QueryException exception) {
        LOGGER.error("unsupported query: {}", exception.getMessage());
        throw new IllegalArgumentException(exception.getMessage(), exception);
      }
    });
  }

  static Optional<UpdateRequest> parseUpdate(String update) {
    return ofNullable(update).filter(StringUtils::isNotBlank).map(u -> {
      try {
        return UpdateFactory.create(u);
      }
      catch (QueryException exception) {
        LOGGER.error("unsupported update: {}", exception.getMessage());
        throw new IllegalArgumentException(exception.getMessage(), exception);
      }
    });
  }
}
