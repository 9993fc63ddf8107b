package uk.curriculum.triplestore.vocabulary;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;

public class CURRIC {
  private static final Model m = ModelFactory.createDefaultModel();

  public static final String NS = "https://w3id.org/uk/curriculum/core/";
  public static final String PREFIX = "curric";

  public static final Resource NAMESPACE = m.createResource(NS);

  // classes
  public static final Resource Phase = m.createResource(NS + "Phase");
  public static final Resource KeyStage = m.createResource(NS + "KeyStage");
  public static final Resource YearGroup = m.createResource(NS + "YearGroup");
  public static final Resource Subject = m.createResource(NS + "Subject");
  public static final Resource SubSubject = m.createResource(NS + "SubSubject");
  public static final Resource Discipline = m.createResource(NS + "Discipline");
  public static final Resource Strand = m.createResource(NS + "Strand");
  public static final Resource SubStrand = m.createResource(NS + "SubStrand");
  public static final Resource ContentDescriptor = m.createResource(NS + "ContentDescriptor");
  public static final Resource ContentSubDescriptor = m.createResource(NS + "ContentSubDescriptor");
  public static final Resource Scheme = m.createResource(NS + "Scheme");
  public static final Resource Progression = m.createResource(NS + "Progression");
  public static final Resource Theme = m.createResource(NS + "Theme");

  // properties
  public static final Property isPartOf = m.createProperty(NS + "isPartOf");
  public static final Property hasPart = m.createProperty(NS + "hasPart");
  public static final Property hasKeyStage = m.createProperty(NS + "hasKeyStage");
  public static final Property hasContentDescriptor = m.createProperty(NS + "hasContentDescriptor");
  public static final Property hasDiscipline = m.createProperty(NS + "hasDiscipline");
  public static final Property hasStrand = m.createProperty(NS + "hasStrand");
  public static final Property hasSubStrand = m.createProperty(NS + "hasSubStrand");
  public static final Property hasAim = m.createProperty(NS + "hasAim");
  public static final Property lowerAgeBoundary = m.createProperty(NS + "lowerAgeBoundary");
  public static final Property upperAgeBoundary = m.createProperty(NS + "upperAgeBoundary");
  public static final Property example = m.createProperty(NS + "example");
  public static final Property exampleURL = m.createProperty(NS + "exampleURL");

  public static String getURI() {
    return NS;
  }
}
