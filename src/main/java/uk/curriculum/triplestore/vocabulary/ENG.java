package uk.curriculum.triplestore.vocabulary;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.Resource;

public class ENG {
  private static final Model m = ModelFactory.createDefaultModel();

  public static final String NS = "https://w3id.org/uk/curriculum/england/";
  public static final String PREFIX = "eng";

  public static final Resource knowledgeTaxonomy = m.createResource(NS + "knowledge-taxonomy");
  public static final Resource themesScheme = m.createResource(NS + "themes-scheme");

  public static String uri(String localName) {
    return NS + localName;
  }

  public static String getURI() {
    return NS;
  }
}
