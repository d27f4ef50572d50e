package com.actionplan.taskimport.service.pipeline.header;

import static com.actionplan.taskimport.service.pipeline.header.HeaderSynonym.contains;
import static com.actionplan.taskimport.service.pipeline.header.HeaderSynonym.exact;

import com.actionplan.taskimport.domain.CanonicalField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accepted header spellings per canonical field. The table is immutable; {@link #with} returns
 * an extended copy so new spellings never require touching the row pipeline.
 */
public final class HeaderSynonymTable {

  private final Map<CanonicalField, List<HeaderSynonym>> synonyms;

  private HeaderSynonymTable(Map<CanonicalField, List<HeaderSynonym>> synonyms) {
    var copy = new EnumMap<CanonicalField, List<HeaderSynonym>>(CanonicalField.class);
    synonyms.forEach((field, list) -> copy.put(field, List.copyOf(list)));
    this.synonyms = Collections.unmodifiableMap(copy);
  }

  /** Synonyms for the French/English action plan workbook. */
  public static HeaderSynonymTable defaults() {
    var table = new EnumMap<CanonicalField, List<HeaderSynonym>>(CanonicalField.class);
    table.put(CanonicalField.ACTION_DESCRIPTION, List.of(contains("action")));
    table.put(CanonicalField.CUSTOMER, List.of(contains("customer"), contains("client")));
    table.put(CanonicalField.REQUESTER, List.of(contains("requester"), contains("demandeur")));
    table.put(CanonicalField.RESPONSIBLE, List.of(contains("resp")));
    // "po" alone would match "Responsable", hence exact
    table.put(
        CanonicalField.PO_NUMBER,
        List.of(
            exact("po"),
            contains("ponumber"),
            contains("purchaseorder"),
            contains("boncommande")));
    table.put(
        CanonicalField.DATE_CREATED,
        List.of(
            exact("date"),
            contains("datecreated"),
            contains("creationdate"),
            contains("datecréation"),
            contains("datecreation")));
    table.put(
        CanonicalField.CATEGORY,
        List.of(contains("catégorie"), contains("categorie"), contains("category")));
    table.put(CanonicalField.AUXILIARY, List.of(contains("colonne1")));
    table.put(
        CanonicalField.DEADLINE,
        List.of(
            contains("deadline"), contains("échéance"), contains("echeance"), contains("duedate")));
    table.put(CanonicalField.STATUS, List.of(contains("status"), contains("statut")));
    table.put(
        CanonicalField.NOTES,
        List.of(exact("note"), exact("notes"), contains("comment"), contains("remarque")));
    table.put(CanonicalField.INSTALLATION_FLAG, List.of(contains("installation")));
    table.put(
        CanonicalField.REPAIR_FLAG,
        List.of(contains("réparation"), contains("reparation"), contains("repair")));
    table.put(
        CanonicalField.DEVELOPMENT_FLAG,
        List.of(
            contains("développement"), contains("developpement"), contains("development")));
    table.put(CanonicalField.DELIVERY_FLAG, List.of(contains("livraison"), contains("delivery")));
    return new HeaderSynonymTable(table);
  }

  public List<HeaderSynonym> synonymsFor(CanonicalField field) {
    return synonyms.getOrDefault(field, List.of());
  }

  public boolean matches(CanonicalField field, String rawHeader) {
    return synonymsFor(field).stream().anyMatch(s -> s.matches(rawHeader));
  }

  /** Copy of this table with one more synonym appended for {@code field}. */
  public HeaderSynonymTable with(CanonicalField field, HeaderSynonym synonym) {
    var extended = new EnumMap<CanonicalField, List<HeaderSynonym>>(CanonicalField.class);
    extended.putAll(synonyms);
    List<HeaderSynonym> list = new ArrayList<>(synonymsFor(field));
    list.add(synonym);
    extended.put(field, list);
    return new HeaderSynonymTable(extended);
  }
}
