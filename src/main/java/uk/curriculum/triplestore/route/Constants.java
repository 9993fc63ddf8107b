package uk.curriculum.triplestore.route;

public interface Constants {
  String UPDATE_QUEUE = "seda:sparql-update";
  String UPDATE_FAILURE_ENDPOINT = "direct:sparql-update-failure";
  String IMPORT_ROUTE_ID = "ImportRoute::Entrypoint";
  String UPDATE_ROUTE_ID = "UpdateRoute::EntryPoint";
}
