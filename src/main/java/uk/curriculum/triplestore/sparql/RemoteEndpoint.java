package uk.curriculum.triplestore.sparql;

import org.apache.commons.lang3.StringUtils;

import java.util.Base64;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

public record RemoteEndpoint(String url, String user, String password) {

  public Optional<String> authorizationHeader() {
    if (StringUtils.isEmpty(user)) {
      return Optional.empty();
    }
    String credentials = user + ":" + StringUtils.defaultString(password);
    return Optional.of("Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(UTF_8)));
  }
}
