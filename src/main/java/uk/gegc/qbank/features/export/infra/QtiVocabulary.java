package uk.gegc.qbank.features.export.infra;

/**
 * Names shared by the QTI package writer and its integrity check.
 */
public final class QtiVocabulary {

    public static final String QTI_NAMESPACE = "http://www.imsglobal.org/xsd/ims_qtiasiv1p2";
    public static final String QTI_SCHEMA_LOCATION =
            "http://www.imsglobal.org/xsd/ims_qtiasiv1p2 http://www.imsglobal.org/xsd/ims_qtiasiv1p2p1.xsd";
    public static final String CP_NAMESPACE = "http://www.imsglobal.org/xsd/imscp_v1p1";
    public static final String MD_NAMESPACE = "http://www.imsglobal.org/xsd/imsmd_v1p2";
    public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";

    public static final String MANIFEST_ENTRY = "imsmanifest.xml";
    public static final String ASSESSMENT_META_ENTRY = "assessment_meta.xml";

    public static final String ASSESSMENT_RESOURCE_TYPE = "imsqti_xmlv1p2";
    public static final String ITEM_RESOURCE_TYPE = "imsqti_item_xmlv1p2";
    public static final String ITEM_RESOURCE_PREFIX = "item_";

    public static final String RESPONSE_IDENT = "response1";
    public static final String SCORE_VARIABLE = "SCORE";

    private QtiVocabulary() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String itemResourceId(String questionId) {
        return ITEM_RESOURCE_PREFIX + questionId;
    }

    /**
     * Response label for the choice at {@code index}: A..Z, then AA, AB and so on.
     */
    public static String choiceLabel(int index) {
        StringBuilder label = new StringBuilder();
        int n = index;
        do {
            label.insert(0, (char) ('A' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return label.toString();
    }
}
