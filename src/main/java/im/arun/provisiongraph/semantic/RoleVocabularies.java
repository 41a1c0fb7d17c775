package im.arun.provisiongraph.semantic;

import im.arun.provisiongraph.catalog.RegulationFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Actor-role vocabularies per regulation family, keyed by language then role.
 * Declaration order is the order in which detected roles are reported.
 */
public final class RoleVocabularies {
    private static final Logger logger = LoggerFactory.getLogger(RoleVocabularies.class);

    private static final RoleDetector AI_DETECTOR = new KeywordRoleDetector("ai_regulation", aiVocabulary());
    private static final RoleDetector MDR_DETECTOR = new KeywordRoleDetector("medical_device_regulation", mdrVocabulary());

    private RoleVocabularies() {}

    /**
     * Detector for a family. Families without a vocabulary detect no roles.
     */
    public static RoleDetector forFamily(RegulationFamily family) {
        if (family == null) {
            family = RegulationFamily.OTHER;
        }
        switch (family) {
            case AI_REGULATION:
                return AI_DETECTOR;
            case MEDICAL_DEVICE_REGULATION:
                return MDR_DETECTOR;
            default:
                logger.warn("No role vocabulary for regulation family {}, roles will be empty", family.getCode());
                return RoleDetector.NONE;
        }
    }

    static Map<String, Map<String, List<String>>> aiVocabulary() {
        Map<String, Map<String, List<String>>> vocabulary = new LinkedHashMap<>();

        Map<String, List<String>> en = new LinkedHashMap<>();
        en.put("provider", List.of("provider", "supplier", "manufacturer", "developer", "downstream provider"));
        en.put("deployer", List.of("deployer", "operator", "user in own authority", "integrator"));
        en.put("authorised_representative", List.of("authorised representative"));
        en.put("importer", List.of("importer"));
        en.put("distributor", List.of("distributor", "reseller"));
        en.put("operator", List.of("operator", "actor"));
        en.put("notified_body", List.of("notified body", "conformity assessment body"));
        en.put("regulator", List.of("AI Office", "national competent authority", "market surveillance authority",
            "notifying authority", "law enforcement authority"));
        en.put("sponsor", List.of("sponsor", "clinical sponsor"));
        vocabulary.put("EN", en);

        Map<String, List<String>> fr = new LinkedHashMap<>();
        fr.put("provider", List.of("fournisseur", "fabricant", "prestataire", "fournisseur en aval"));
        fr.put("deployer", List.of("déployeur", "opérateur", "utilisateur en propre", "intégrateur"));
        fr.put("authorised_representative", List.of("mandataire"));
        fr.put("importer", List.of("importateur"));
        fr.put("distributor", List.of("distributeur"));
        fr.put("operator", List.of("opérateur", "acteur"));
        fr.put("notified_body", List.of("organisme notifié", "organisme d'évaluation de la conformité"));
        fr.put("regulator", List.of("Bureau de l'IA", "autorité nationale compétente",
            "autorité de surveillance du marché", "autorité notifiante", "autorités répressives"));
        fr.put("sponsor", List.of("sponsor", "sponsor clinique"));
        vocabulary.put("FR", fr);

        Map<String, List<String>> de = new LinkedHashMap<>();
        de.put("provider", List.of("anbieter", "hersteller", "lieferant", "nachgelagerter anbieter"));
        de.put("deployer", List.of("betreiber", "nutzer in eigener verantwortung", "integrator"));
        de.put("authorised_representative", List.of("bevollmächtigter"));
        de.put("importer", List.of("einführer"));
        de.put("distributor", List.of("händler"));
        de.put("operator", List.of("akteur"));
        de.put("notified_body", List.of("notifizierte stelle", "konformitätsbewertungsstelle"));
        de.put("regulator", List.of("Büro für Künstliche Intelligenz", "zuständige nationale Behörde",
            "marktüberwachungsbehörde", "notifizierende Behörde", "Strafverfolgungsbehörde"));
        de.put("sponsor", List.of("sponsor", "klinischer sponsor"));
        vocabulary.put("DE", de);

        return vocabulary;
    }

    static Map<String, Map<String, List<String>>> mdrVocabulary() {
        Map<String, Map<String, List<String>>> vocabulary = new LinkedHashMap<>();

        Map<String, List<String>> en = new LinkedHashMap<>();
        en.put("manufacturer", List.of("manufacturer", "legal manufacturer"));
        en.put("authorised_representative", List.of("authorised representative"));
        en.put("importer", List.of("importer"));
        en.put("distributor", List.of("distributor", "economic operator"));
        en.put("notified_body", List.of("notified body"));
        en.put("conformity_assessment_body", List.of("conformity assessment body"));
        en.put("sponsor", List.of("sponsor", "clinical sponsor"));
        en.put("investigator", List.of("investigator"));
        en.put("ethics_committee", List.of("ethics committee"));
        en.put("health_institution", List.of("health institution", "hospital"));
        en.put("user", List.of("user", "professional user", "healthcare professional"));
        en.put("lay_person", List.of("lay person", "lay user"));
        en.put("market_surveillance_authority", List.of("market surveillance authority"));
        en.put("competent_authority", List.of("competent authority"));
        vocabulary.put("EN", en);

        Map<String, List<String>> fr = new LinkedHashMap<>();
        fr.put("manufacturer", List.of("fabricant"));
        fr.put("authorised_representative", List.of("mandataire"));
        fr.put("importer", List.of("importateur"));
        fr.put("distributor", List.of("distributeur", "opérateur économique"));
        fr.put("notified_body", List.of("organisme notifié"));
        fr.put("conformity_assessment_body", List.of("organisme d'évaluation de la conformité"));
        fr.put("sponsor", List.of("sponsor", "promoteur"));
        fr.put("investigator", List.of("investigateur"));
        fr.put("ethics_committee", List.of("comité d'éthique"));
        fr.put("health_institution", List.of("établissement de santé"));
        fr.put("user", List.of("utilisateur", "professionnel de santé"));
        fr.put("lay_person", List.of("profane"));
        fr.put("market_surveillance_authority", List.of("autorité de surveillance du marché"));
        fr.put("competent_authority", List.of("autorité compétente"));
        vocabulary.put("FR", fr);

        Map<String, List<String>> de = new LinkedHashMap<>();
        de.put("manufacturer", List.of("hersteller"));
        de.put("authorised_representative", List.of("bevollmächtigter"));
        de.put("importer", List.of("einführer"));
        de.put("distributor", List.of("händler", "wirtschaftsakteur"));
        de.put("notified_body", List.of("benannte stelle"));
        de.put("conformity_assessment_body", List.of("konformitätsbewertungsstelle"));
        de.put("sponsor", List.of("sponsor"));
        de.put("investigator", List.of("prüfer"));
        de.put("ethics_committee", List.of("ethik-kommission"));
        de.put("health_institution", List.of("gesundheitseinrichtung"));
        de.put("user", List.of("anwender", "gesundheitsfachkraft"));
        de.put("lay_person", List.of("laie"));
        de.put("market_surveillance_authority", List.of("marktüberwachungsbehörde"));
        de.put("competent_authority", List.of("zuständige behörde"));
        vocabulary.put("DE", de);

        return vocabulary;
    }
}
