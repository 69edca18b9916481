package uk.gegc.qbank.features.export.application.impl;

import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import uk.gegc.qbank.features.export.application.ExportInspector;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.ExportIssue;
import uk.gegc.qbank.features.export.domain.model.ExportIssueCode;
import uk.gegc.qbank.features.export.infra.XmlDocuments;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;
import uk.gegc.qbank.features.question.domain.model.QuestionType;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static uk.gegc.qbank.features.export.infra.QtiVocabulary.*;

/**
 * Reopens a QTI archive and checks it against the collection it was built from.
 */
@Component
public class QtiPackageInspector implements ExportInspector {

    private static final Set<String> SINGLE_ANSWER_ITEM_TYPES = Set.of(
            QuestionType.MULTIPLE_CHOICE.lmsItemType(),
            QuestionType.TRUE_FALSE.lmsItemType()
    );

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.QTI_PACKAGE;
    }

    @Override
    public List<ExportIssue> inspect(byte[] content, QuestionCollection source) {
        List<ExportIssue> issues = new ArrayList<>();

        Map<String, byte[]> entries;
        try {
            entries = unzip(content);
        } catch (IOException e) {
            issues.add(ExportIssue.of(ExportIssueCode.CORRUPT_ARCHIVE, "Package is not a readable zip archive: " + e.getMessage()));
            return issues;
        }
        if (entries.isEmpty()) {
            issues.add(ExportIssue.of(ExportIssueCode.CORRUPT_ARCHIVE, "Package is not a zip archive or is empty"));
            return issues;
        }

        byte[] manifestBytes = entries.get(MANIFEST_ENTRY);
        if (manifestBytes == null) {
            issues.add(ExportIssue.of(ExportIssueCode.MISSING_ENTRY, "Archive has no " + MANIFEST_ENTRY));
            return issues;
        }
        Document manifest = parse(MANIFEST_ENTRY, manifestBytes, issues);
        if (manifest == null) {
            return issues;
        }

        String assessmentHref = assessmentHref(manifest);
        if (assessmentHref == null) {
            issues.add(ExportIssue.of(ExportIssueCode.MISSING_ENTRY,
                    "Manifest does not reference an assessment resource of type " + ASSESSMENT_RESOURCE_TYPE));
            return issues;
        }
        byte[] assessmentBytes = entries.get(assessmentHref);
        if (assessmentBytes == null) {
            issues.add(ExportIssue.of(ExportIssueCode.MISSING_ENTRY,
                    "Archive has no " + assessmentHref + " referenced by the manifest"));
            return issues;
        }
        Document assessment = parse(assessmentHref, assessmentBytes, issues);
        if (assessment == null) {
            return issues;
        }

        Set<String> itemIdents = new LinkedHashSet<>();
        NodeList items = assessment.getElementsByTagNameNS("*", "item");
        for (int i = 0; i < items.getLength(); i++) {
            Element item = (Element) items.item(i);
            itemIdents.add(item.getAttribute("ident"));
            checkCorrectMarkers(item, issues);
        }

        for (Question question : source.questions()) {
            if (!itemIdents.contains(question.id())) {
                issues.add(new ExportIssue(ExportIssueCode.MISSING_ITEM, question.id(),
                        "No assessment item for question " + question.id()));
            }
        }

        Set<String> manifestResources = manifestResourceIds(manifest);
        for (String ident : itemIdents) {
            if (!manifestResources.contains(itemResourceId(ident))) {
                issues.add(new ExportIssue(ExportIssueCode.MISSING_MANIFEST_ENTRY, ident,
                        "Item " + ident + " is not enumerated in the manifest"));
            }
        }
        return issues;
    }

    private void checkCorrectMarkers(Element item, List<ExportIssue> issues) {
        if (!SINGLE_ANSWER_ITEM_TYPES.contains(itemType(item))) {
            return;
        }
        int markers = 0;
        NodeList resprocessing = item.getElementsByTagNameNS("*", "resprocessing");
        for (int i = 0; i < resprocessing.getLength(); i++) {
            markers += ((Element) resprocessing.item(i)).getElementsByTagNameNS("*", "varequal").getLength();
        }
        if (markers != 1) {
            String ident = item.getAttribute("ident");
            issues.add(new ExportIssue(ExportIssueCode.CORRECT_MARKER_COUNT, ident,
                    "Item " + ident + " has " + markers + " correct-response markers, expected 1"));
        }
    }

    private String itemType(Element item) {
        NodeList fields = item.getElementsByTagNameNS("*", "qtimetadatafield");
        for (int i = 0; i < fields.getLength(); i++) {
            Element field = (Element) fields.item(i);
            if ("question_type".equals(childText(field, "fieldlabel"))) {
                return childText(field, "fieldentry");
            }
        }
        return null;
    }

    private String childText(Element parent, String localName) {
        NodeList children = parent.getElementsByTagNameNS("*", localName);
        return children.getLength() > 0 ? children.item(0).getTextContent().trim() : null;
    }

    private String assessmentHref(Document manifest) {
        NodeList resources = manifest.getElementsByTagNameNS("*", "resource");
        for (int i = 0; i < resources.getLength(); i++) {
            Element resource = (Element) resources.item(i);
            if (ASSESSMENT_RESOURCE_TYPE.equals(resource.getAttribute("type"))) {
                String href = resource.getAttribute("href");
                return href.isBlank() ? null : href;
            }
        }
        return null;
    }

    private Set<String> manifestResourceIds(Document manifest) {
        Set<String> ids = new HashSet<>();
        NodeList resources = manifest.getElementsByTagNameNS("*", "resource");
        for (int i = 0; i < resources.getLength(); i++) {
            ids.add(((Element) resources.item(i)).getAttribute("identifier"));
        }
        return ids;
    }

    private Document parse(String entryName, byte[] bytes, List<ExportIssue> issues) {
        try {
            return XmlDocuments.parse(bytes);
        } catch (SAXException e) {
            issues.add(ExportIssue.of(ExportIssueCode.MALFORMED_XML, entryName + " is not well-formed: " + e.getMessage()));
            return null;
        }
    }

    private Map<String, byte[]> unzip(byte[] content) throws IOException {
        Map<String, byte[]> entries = new HashMap<>();
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(content))) {
            ZipEntry entry;
            byte[] buffer = new byte[8192];
            while ((entry = zis.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                int len;
                while ((len = zis.read(buffer)) > 0) {
                    out.write(buffer, 0, len);
                }
                entries.put(entry.getName(), out.toByteArray());
            }
        }
        return entries;
    }
}
