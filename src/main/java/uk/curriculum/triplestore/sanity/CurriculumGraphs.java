package uk.curriculum.triplestore.sanity;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.vocabulary.DCTerms;
import org.apache.jena.vocabulary.DC_11;
import org.apache.jena.vocabulary.OWL;
import org.apache.jena.vocabulary.RDF;
import org.apache.jena.vocabulary.RDFS;
import org.apache.jena.vocabulary.SKOS;
import org.apache.jena.vocabulary.XSD;
import org.springframework.stereotype.Component;
import uk.curriculum.triplestore.vocabulary.CURRIC;
import uk.curriculum.triplestore.vocabulary.ENG;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static uk.curriculum.triplestore.sanity.SanityIds.reference;
import static uk.curriculum.triplestore.sanity.SanityIds.slug;
import static uk.curriculum.triplestore.sanity.SanityIds.uri;

/**
 * Maps Sanity documents onto the curriculum vocabulary, one method per document type. Required
 * fields missing from a document raise a {@link SanityException}; optional ones are skipped when
 * absent or empty.
 */
@Component
public class CurriculumGraphs {
  static final String LANG = "en";
  static final String VERSION = "0.1.0";
  static final String CREATOR = "Department for Education";
  static final String LICENSE = "http://www.nationalarchives.gov.uk/doc/open-government-licence/version/3/";
  static final String RIGHTS = "Crown Copyright";

  private final Clock clock;

  public CurriculumGraphs() {
    this(Clock.systemDefaultZone());
  }

  CurriculumGraphs(Clock clock) {
    this.clock = clock;
  }

  public Model createModel() {
    Model model = ModelFactory.createDefaultModel();
    model.setNsPrefix(CURRIC.PREFIX, CURRIC.NS);
    model.setNsPrefix(ENG.PREFIX, ENG.NS);
    model.setNsPrefix("rdf", RDF.getURI());
    model.setNsPrefix("rdfs", RDFS.getURI());
    model.setNsPrefix("owl", OWL.getURI());
    model.setNsPrefix("skos", SKOS.getURI());
    model.setNsPrefix("dc", DC_11.getURI());
    model.setNsPrefix("dcterms", DCTerms.getURI());
    model.setNsPrefix("xsd", XSD.getURI());
    return model;
  }

  public void addOntologyHeader(Model model, String ontologyUri, String title, String description) {
    model.createResource(ontologyUri)
         .addProperty(RDF.type, OWL.Ontology)
         .addProperty(RDFS.label, title, LANG)
         .addProperty(DC_11.title, title, LANG)
         .addProperty(RDFS.comment, description, LANG)
         .addProperty(OWL.versionInfo, VERSION)
         .addProperty(DCTerms.creator, CREATOR)
         .addProperty(DCTerms.created, model.createTypedLiteral(LocalDate.now(clock).toString(), XSDDatatype.XSDdate))
         .addProperty(DCTerms.license, model.createResource(LICENSE))
         .addProperty(DCTerms.rights, RIGHTS, LANG)
         .addProperty(OWL.imports, CURRIC.NAMESPACE);
  }

  public void convertPhases(List<JsonNode> documents, Model model) {
    documents.forEach(doc -> ageBounded(labelled(doc, model, CURRIC.Phase), doc));
  }

  public void convertKeyStages(List<JsonNode> documents, Model model) {
    for (JsonNode doc : documents) {
      Resource keyStage = ageBounded(labelled(doc, model, CURRIC.KeyStage), doc);
      link(keyStage, CURRIC.isPartOf, doc, "phase");
    }
  }

  public void convertYearGroups(List<JsonNode> documents, Model model) {
    for (JsonNode doc : documents) {
      Resource yearGroup = ageBounded(labelled(doc, model, CURRIC.YearGroup), doc);
      link(yearGroup, CURRIC.isPartOf, doc, "keyStage");
    }
  }

  public void convertSubjects(List<JsonNode> documents, Model model) {
    for (JsonNode doc : documents) {
      Resource subject = labelled(doc, model, CURRIC.Subject);
      linkAll(subject, CURRIC.hasDiscipline, doc, "disciplines");
    }
  }

  public void convertSubSubjects(List<JsonNode> documents, Model model) {
    for (JsonNode doc : documents) {
      Resource subSubject = labelled(doc, model, CURRIC.SubSubject);
      optionalText(doc, "fullDescription").ifPresent(text -> subSubject.addProperty(DCTerms.description, text, LANG));
      optionalText(doc, "sourceUrl").ifPresent(url -> subSubject.addProperty(DCTerms.source, model.createResource(url)));
      link(subSubject, CURRIC.isPartOf, doc, "subject");
      linkAll(subSubject, CURRIC.hasStrand, doc, "strands");
      doc.path("aims").forEach(aim -> optionalText(aim, "aimText")
              .ifPresent(text -> subSubject.addProperty(CURRIC.hasAim, text, LANG)));
    }
  }

  public void convertDisciplines(List<JsonNode> documents, Model model) {
    for (JsonNode doc : documents) {
      Resource discipline = concept(doc, model, CURRIC.Discipline, ENG.knowledgeTaxonomy);
      discipline.addProperty(SKOS.definition, required(doc, "definition"), LANG);
      optionalText(doc, "scopeNote").ifPresent(note -> discipline.addProperty(SKOS.scopeNote, note, LANG));
      discipline.addProperty(SKOS.topConceptOf, ENG.knowledgeTaxonomy);
    }
  }

  public void convertStrands(List<JsonNode> documents, Model model) {
    documents.forEach(doc -> narrower(doc, model, CURRIC.Strand, "discipline"));
  }

  public void convertSubStrands(List<JsonNode> documents, Model model) {
    documents.forEach(doc -> narrower(doc, model, CURRIC.SubStrand, "strand"));
  }

  public void convertContentDescriptors(List<JsonNode> documents, Model model) {
    documents.forEach(doc -> narrower(doc, model, CURRIC.ContentDescriptor, "substrand"));
  }

  public void convertContentSubDescriptors(List<JsonNode> documents, Model model) {
    for (JsonNode doc : documents) {
      Resource subDescriptor = narrower(doc, model, CURRIC.ContentSubDescriptor, "contentDescriptor");
      optionalText(doc, "exampleText").ifPresent(text -> subDescriptor.addProperty(CURRIC.example, text, LANG));
      optionalText(doc, "exampleUrl").ifPresent(url -> subDescriptor.addProperty(CURRIC.exampleURL,
                                                                                 model.createTypedLiteral(url, XSDDatatype.XSDanyURI)));
    }
  }

  public void convertSchemes(List<JsonNode> documents, Model model) {
    for (JsonNode doc : documents) {
      Resource scheme = labelled(doc, model, CURRIC.Scheme);
      link(scheme, CURRIC.isPartOf, doc, "subsubject");
      link(scheme, CURRIC.hasKeyStage, doc, "keyStage");
      linkAll(scheme, CURRIC.hasContentDescriptor, doc, "contentDescriptors");
    }
  }

  public void convertProgressions(List<JsonNode> documents, Model model) {
    for (JsonNode doc : documents) {
      Resource progression = labelled(doc, model, CURRIC.Progression);
      link(progression, CURRIC.isPartOf, doc, "scheme");
      link(progression, CURRIC.hasSubStrand, doc, "substrand");
      linkAll(progression, CURRIC.hasContentDescriptor, doc, "contentDescriptors");
    }
  }

  public void addThemesScheme(Model model) {
    model.createResource(ENG.themesScheme.getURI())
         .addProperty(RDF.type, SKOS.ConceptScheme)
         .addProperty(SKOS.prefLabel, "Cross-Cutting Themes", LANG);
  }

  public void convertThemes(List<JsonNode> documents, Model model) {
    for (JsonNode doc : documents) {
      concept(doc, model, CURRIC.Theme, ENG.themesScheme).addProperty(SKOS.definition, required(doc, "definition"), LANG);
    }
  }

  private Resource labelled(JsonNode doc, Model model, Resource type) {
    return model.createResource(uri(slug(doc)))
                .addProperty(RDF.type, type)
                .addProperty(RDFS.label, required(doc, "label"), LANG)
                .addProperty(RDFS.comment, required(doc, "description"), LANG);
  }

  private Resource ageBounded(Resource resource, JsonNode doc) {
    Model model = resource.getModel();
    return resource.addProperty(CURRIC.lowerAgeBoundary,
                                model.createTypedLiteral(requiredInt(doc, "lowerAgeBoundary"), XSDDatatype.XSDnonNegativeInteger))
                   .addProperty(CURRIC.upperAgeBoundary,
                                model.createTypedLiteral(requiredInt(doc, "upperAgeBoundary"), XSDDatatype.XSDpositiveInteger));
  }

  private Resource concept(JsonNode doc, Model model, Resource type, Resource scheme) {
    return model.createResource(uri(slug(doc)))
                .addProperty(RDF.type, SKOS.Concept)
                .addProperty(RDF.type, type)
                .addProperty(SKOS.prefLabel, required(doc, "prefLabel"), LANG)
                .addProperty(SKOS.inScheme, scheme);
  }

  private Resource narrower(JsonNode doc, Model model, Resource type, String broaderField) {
    Resource concept = concept(doc, model, type, ENG.knowledgeTaxonomy);
    optionalText(doc, "definition").ifPresent(text -> concept.addProperty(SKOS.definition, text, LANG));
    link(concept, SKOS.broader, doc, broaderField);
    return concept;
  }

  private static void link(Resource subject, Property property, JsonNode doc, String field) {
    reference(doc, field).ifPresent(id -> subject.addProperty(property, subject.getModel().createResource(uri(id))));
  }

  private static void linkAll(Resource subject, Property property, JsonNode doc, String field) {
    doc.path(field).forEach(ref -> reference(ref).filter(StringUtils::isNotEmpty)
                                                  .ifPresent(id -> subject.addProperty(property, subject.getModel().createResource(uri(id)))));
  }

  private static String required(JsonNode doc, String field) {
    JsonNode value = doc.get(field);
    if (value == null || value.isNull()) {
      throw new SanityException("document %s has no %s".formatted(slug(doc), field));
    }
    return value.asText();
  }

  private static String requiredInt(JsonNode doc, String field) {
    JsonNode value = doc.get(field);
    if (value == null || !value.canConvertToInt()) {
      throw new SanityException("document %s has no integer %s".formatted(slug(doc), field));
    }
    return String.valueOf(value.asInt());
  }

  private static Optional<String> optionalText(JsonNode doc, String field) {
    return Optional.ofNullable(doc.get(field))
                   .filter(JsonNode::isValueNode)
                   .map(JsonNode::asText)
                   .filter(StringUtils::isNotBlank);
  }
}
