package uk.gegc.qbank.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import uk.gegc.qbank.features.export.application.ExportRenderer;
import uk.gegc.qbank.features.export.application.QuestionNotationPreparer;
import uk.gegc.qbank.features.export.domain.model.ExportFile;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.ExportPayload;
import uk.gegc.qbank.features.export.domain.model.PackagingFailure;
import uk.gegc.qbank.features.export.domain.model.RenderedPackage;
import uk.gegc.qbank.features.export.infra.ExportMediaTypeResolver;
import uk.gegc.qbank.features.export.infra.XmlDocuments;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;
import uk.gegc.qbank.features.question.infra.rules.NumericalRules;
import uk.gegc.qbank.features.question.infra.rules.TrueFalseRules;
import uk.gegc.qbank.shared.exception.NotationException;
import uk.gegc.qbank.shared.exception.PackagingException;
import uk.gegc.qbank.shared.util.NumberText;

import javax.xml.XMLConstants;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static uk.gegc.qbank.features.export.infra.QtiVocabulary.*;

/**
 * Renders a collection as a QTI 1.2 content package. The build is all-or-nothing: if any question cannot be
 * rendered, no archive is produced and every failed question is reported together.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QtiPackageRenderer implements ExportRenderer {

    private static final DateTimeFormatter CREATED_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final QuestionNotationPreparer notationPreparer;
    private final ExportMediaTypeResolver mediaTypeResolver;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.QTI_PACKAGE;
    }

    @Override
    public RenderedPackage render(ExportPayload payload) {
        String assessmentEntry = payload.filenameBase() + ".xml";

        Document assessment = XmlDocuments.newDocument();
        Element section = createAssessmentSkeleton(assessment, payload);

        List<PackagingFailure> failures = new ArrayList<>();
        List<String> itemIds = new ArrayList<>();
        List<Question> questions = payload.collection().questions();
        for (int position = 0; position < questions.size(); position++) {
            Question question = questions.get(position);
            try {
                Question prepared = notationPreparer.prepare(question, payload.dialect());
                section.appendChild(createItem(assessment, prepared));
                itemIds.add(question.id());
            } catch (NotationException | IllegalArgumentException e) {
                log.debug("QTI item rendering failed: id={}, reason={}", question.id(), e.getMessage());
                failures.add(new PackagingFailure(position, question.id(), e.getMessage()));
            }
        }
        if (!failures.isEmpty()) {
            throw new PackagingException(failures);
        }

        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put(assessmentEntry, XmlDocuments.serialize(assessment));
        entries.put(MANIFEST_ENTRY, XmlDocuments.serialize(createManifest(payload, assessmentEntry, itemIds)));
        entries.put(ASSESSMENT_META_ENTRY, XmlDocuments.serialize(createAssessmentMeta(payload)));

        byte[] bytes = zip(entries);
        ExportFile file = ExportFile.ofBytes(
                payload.filenameBase() + "." + mediaTypeResolver.fileExtensionFor(ExportFormat.QTI_PACKAGE),
                mediaTypeResolver.contentTypeFor(ExportFormat.QTI_PACKAGE),
                bytes
        );
        return new RenderedPackage(file, List.of());
    }

    private Element createAssessmentSkeleton(Document doc, ExportPayload payload) {
        Element root = doc.createElementNS(QTI_NAMESPACE, "questestinterop");
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:xsi", XSI_NAMESPACE);
        root.setAttributeNS(XSI_NAMESPACE, "xsi:schemaLocation", QTI_SCHEMA_LOCATION);
        doc.appendChild(root);

        Element assessment = qti(doc, root, "assessment");
        assessment.setAttribute("ident", payload.filenameBase());
        assessment.setAttribute("title", payload.title());

        Element metadata = qti(doc, assessment, "qtimetadata");
        metadataField(doc, metadata, "cc_maxattempts", "1");
        metadataField(doc, metadata, "qmd_timelimit", "0");
        metadataField(doc, metadata, "cc_profile", "cc.exam.v0p1");

        Element section = qti(doc, assessment, "section");
        section.setAttribute("ident", "root_section");
        return section;
    }

    private Element createItem(Document doc, Question question) {
        if (question.id() == null || question.id().isBlank()) {
            throw new IllegalArgumentException("Question id is required");
        }
        if (question.type() == null) {
            throw new IllegalArgumentException("Question type is not recognized");
        }

        Element item = doc.createElementNS(QTI_NAMESPACE, "item");
        item.setAttribute("ident", question.id());
        item.setAttribute("title", question.id());

        Element itemMetadata = qti(doc, qti(doc, item, "itemmetadata"), "qtimetadata");
        metadataField(doc, itemMetadata, "question_type", question.type().lmsItemType());
        metadataField(doc, itemMetadata, "points_possible", NumberText.plain(question.points()));
        if (question.topic() != null) {
            metadataField(doc, itemMetadata, "topic", question.topic());
        }
        if (question.subtopic() != null) {
            metadataField(doc, itemMetadata, "subtopic", question.subtopic());
        }
        if (question.difficulty() != null) {
            metadataField(doc, itemMetadata, "difficulty", question.difficulty());
        }

        Element presentation = qti(doc, item, "presentation");
        material(doc, presentation, question.text());

        Element resprocessing = doc.createElementNS(QTI_NAMESPACE, "resprocessing");
        Element decvar = qti(doc, qti(doc, resprocessing, "outcomes"), "decvar");
        decvar.setAttribute("maxvalue", NumberText.plain(question.points()));
        decvar.setAttribute("minvalue", "0");
        decvar.setAttribute("varname", SCORE_VARIABLE);
        decvar.setAttribute("vartype", "Decimal");

        switch (question.type()) {
            case MULTIPLE_CHOICE -> renderChoices(doc, presentation, resprocessing, question,
                    question.choices(), question.correctAnswer());
            case TRUE_FALSE -> renderChoices(doc, presentation, resprocessing, question,
                    List.of(TrueFalseRules.TRUE, TrueFalseRules.FALSE), question.correctAnswer());
            case NUMERICAL -> renderNumerical(doc, presentation, resprocessing, question);
            case FILL_IN_BLANK, SHORT_ANSWER -> renderTextEntry(doc, presentation, resprocessing, question);
            case ESSAY -> renderEssay(doc, presentation);
        }

        appendIncorrectFallback(doc, resprocessing, question);
        item.appendChild(resprocessing);
        if (question.feedbackCorrect() != null) {
            feedbackBlock(doc, item, "correct_fb", question.feedbackCorrect());
        }
        if (question.feedbackIncorrect() != null) {
            feedbackBlock(doc, item, "general_incorrect_fb", question.feedbackIncorrect());
        }
        return item;
    }

    private void renderChoices(Document doc, Element presentation, Element resprocessing, Question question,
                               List<String> choices, String correctAnswer) {
        int correctIndex = correctAnswer != null ? choices.indexOf(correctAnswer) : -1;
        if (correctIndex < 0) {
            throw new IllegalArgumentException("Correct answer does not match any choice");
        }

        Element responseLid = qti(doc, presentation, "response_lid");
        responseLid.setAttribute("ident", RESPONSE_IDENT);
        responseLid.setAttribute("rcardinality", "Single");
        Element renderChoice = qti(doc, responseLid, "render_choice");
        renderChoice.setAttribute("shuffle", "No");
        for (int i = 0; i < choices.size(); i++) {
            Element label = qti(doc, renderChoice, "response_label");
            label.setAttribute("ident", choiceLabel(i));
            material(doc, label, choices.get(i));
        }

        Element conditionvar = scoringCondition(doc, resprocessing, question);
        Element varequal = qti(doc, conditionvar, "varequal");
        varequal.setAttribute("respident", RESPONSE_IDENT);
        varequal.setTextContent(choiceLabel(correctIndex));
    }

    private void renderNumerical(Document doc, Element presentation, Element resprocessing, Question question) {
        OptionalDouble answer = NumericalRules.parseAnswer(question.correctAnswer());
        if (answer.isEmpty()) {
            throw new IllegalArgumentException("Numerical answer is not a number: " + question.correctAnswer());
        }

        Element responseNum = qti(doc, presentation, "response_num");
        responseNum.setAttribute("ident", RESPONSE_IDENT);
        responseNum.setAttribute("rcardinality", "Single");
        Element renderFib = qti(doc, responseNum, "render_fib");
        renderFib.setAttribute("fibtype", "Decimal");

        // decimal arithmetic keeps 3.14 - 0.01 from printing as 3.1300000000000003
        BigDecimal exact = BigDecimal.valueOf(answer.getAsDouble());
        BigDecimal tolerance = BigDecimal.valueOf(question.tolerance());
        Element conditionvar = scoringCondition(doc, resprocessing, question);
        Element vargte = qti(doc, conditionvar, "vargte");
        vargte.setAttribute("respident", RESPONSE_IDENT);
        vargte.setTextContent(NumberText.plain(exact.subtract(tolerance)));
        Element varlte = qti(doc, conditionvar, "varlte");
        varlte.setAttribute("respident", RESPONSE_IDENT);
        varlte.setTextContent(NumberText.plain(exact.add(tolerance)));
    }

    private void renderTextEntry(Document doc, Element presentation, Element resprocessing, Question question) {
        Element responseStr = qti(doc, presentation, "response_str");
        responseStr.setAttribute("ident", RESPONSE_IDENT);
        responseStr.setAttribute("rcardinality", "Single");
        Element renderFib = qti(doc, responseStr, "render_fib");
        renderFib.setAttribute("fibtype", "String");

        Element conditionvar = scoringCondition(doc, resprocessing, question);
        Element varequal = qti(doc, conditionvar, "varequal");
        varequal.setAttribute("respident", RESPONSE_IDENT);
        varequal.setAttribute("case", "No");
        varequal.setTextContent(question.correctAnswer() != null ? question.correctAnswer() : "");
    }

    private void renderEssay(Document doc, Element presentation) {
        Element responseStr = qti(doc, presentation, "response_str");
        responseStr.setAttribute("ident", RESPONSE_IDENT);
        responseStr.setAttribute("rcardinality", "Single");
        Element renderFib = qti(doc, responseStr, "render_fib");
        renderFib.setAttribute("fibtype", "String");
        renderFib.setAttribute("rows", "8");
        renderFib.setAttribute("columns", "60");
    }

    /**
     * Appends a {@code respcondition} awarding full points and returns its still empty {@code conditionvar}.
     */
    private Element scoringCondition(Document doc, Element resprocessing, Question question) {
        Element respcondition = qti(doc, resprocessing, "respcondition");
        respcondition.setAttribute("continue", "No");
        Element conditionvar = qti(doc, respcondition, "conditionvar");
        Element setvar = qti(doc, respcondition, "setvar");
        setvar.setAttribute("action", "Set");
        setvar.setAttribute("varname", SCORE_VARIABLE);
        setvar.setTextContent(NumberText.plain(question.points()));
        if (question.feedbackCorrect() != null) {
            Element display = qti(doc, respcondition, "displayfeedback");
            display.setAttribute("feedbacktype", "Response");
            display.setAttribute("linkrefid", "correct_fb");
        }
        return conditionvar;
    }

    private void appendIncorrectFallback(Document doc, Element resprocessing, Question question) {
        if (question.feedbackIncorrect() == null || question.type() == QuestionType.ESSAY) {
            return;
        }
        Element fallback = qti(doc, resprocessing, "respcondition");
        fallback.setAttribute("continue", "Yes");
        qti(doc, qti(doc, fallback, "conditionvar"), "other");
        Element display = qti(doc, fallback, "displayfeedback");
        display.setAttribute("feedbacktype", "Response");
        display.setAttribute("linkrefid", "general_incorrect_fb");
    }

    private void feedbackBlock(Document doc, Element item, String ident, String text) {
        Element feedback = qti(doc, item, "itemfeedback");
        feedback.setAttribute("ident", ident);
        material(doc, qti(doc, feedback, "flow_mat"), text);
    }

    private Document createManifest(ExportPayload payload, String assessmentEntry, List<String> itemIds) {
        Document doc = XmlDocuments.newDocument();
        Element manifest = doc.createElementNS(CP_NAMESPACE, "manifest");
        manifest.setAttribute("identifier", payload.filenameBase() + "_manifest");
        manifest.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:imsmd", MD_NAMESPACE);
        doc.appendChild(manifest);

        Element metadata = cp(doc, manifest, "metadata");
        cp(doc, metadata, "schema").setTextContent("IMS Content");
        cp(doc, metadata, "schemaversion").setTextContent("1.1.3");
        Element lom = doc.createElementNS(MD_NAMESPACE, "imsmd:lom");
        metadata.appendChild(lom);
        Element general = doc.createElementNS(MD_NAMESPACE, "imsmd:general");
        lom.appendChild(general);
        Element title = doc.createElementNS(MD_NAMESPACE, "imsmd:title");
        general.appendChild(title);
        Element langstring = doc.createElementNS(MD_NAMESPACE, "imsmd:langstring");
        langstring.setTextContent(payload.title());
        title.appendChild(langstring);

        Element organizations = cp(doc, manifest, "organizations");
        organizations.setAttribute("default", "TOC");
        Element organization = cp(doc, organizations, "organization");
        organization.setAttribute("identifier", "TOC");
        cp(doc, organization, "title").setTextContent(payload.title());
        Element orgItem = cp(doc, organization, "item");
        orgItem.setAttribute("identifier", "assessment_item");
        orgItem.setAttribute("identifierref", "assessment");
        cp(doc, orgItem, "title").setTextContent(payload.title());

        Element resources = cp(doc, manifest, "resources");
        Element assessmentResource = cp(doc, resources, "resource");
        assessmentResource.setAttribute("identifier", "assessment");
        assessmentResource.setAttribute("type", ASSESSMENT_RESOURCE_TYPE);
        assessmentResource.setAttribute("href", assessmentEntry);
        cp(doc, assessmentResource, "file").setAttribute("href", assessmentEntry);
        for (String itemId : itemIds) {
            cp(doc, assessmentResource, "dependency").setAttribute("identifierref", itemResourceId(itemId));
        }

        for (String itemId : itemIds) {
            Element itemResource = cp(doc, resources, "resource");
            itemResource.setAttribute("identifier", itemResourceId(itemId));
            itemResource.setAttribute("type", ITEM_RESOURCE_TYPE);
            itemResource.setAttribute("href", assessmentEntry);
        }

        Element metaResource = cp(doc, resources, "resource");
        metaResource.setAttribute("identifier", "assessment_meta");
        metaResource.setAttribute("type", "associatedcontent/imscc_xmlv1p1/learning-application-resource");
        metaResource.setAttribute("href", ASSESSMENT_META_ENTRY);
        cp(doc, metaResource, "file").setAttribute("href", ASSESSMENT_META_ENTRY);
        return doc;
    }

    private Document createAssessmentMeta(ExportPayload payload) {
        Document doc = XmlDocuments.newDocument();
        Element root = doc.createElement("assessment_meta");
        doc.appendChild(root);
        int count = payload.collection().size();
        appendText(doc, root, "title", payload.title());
        appendText(doc, root, "description", "Assessment with " + count + " questions");
        appendText(doc, root, "created_date", payload.generatedAt().format(CREATED_DATE_FORMAT));
        appendText(doc, root, "question_count", String.valueOf(count));
        return doc;
    }

    private byte[] zip(Map<String, byte[]> entries) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue());
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write QTI archive", e);
        }
        return out.toByteArray();
    }

    private void metadataField(Document doc, Element qtimetadata, String label, String entry) {
        Element field = qti(doc, qtimetadata, "qtimetadatafield");
        qti(doc, field, "fieldlabel").setTextContent(label);
        qti(doc, field, "fieldentry").setTextContent(entry);
    }

    private void material(Document doc, Element parent, String text) {
        Element mattext = qti(doc, qti(doc, parent, "material"), "mattext");
        mattext.setAttribute("texttype", "text/html");
        mattext.setTextContent(text != null ? text : "");
    }

    private void appendText(Document doc, Element parent, String name, String text) {
        Element child = doc.createElement(name);
        child.setTextContent(text);
        parent.appendChild(child);
    }

    private Element qti(Document doc, Element parent, String name) {
        Element child = doc.createElementNS(QTI_NAMESPACE, name);
        parent.appendChild(child);
        return child;
    }

    private Element cp(Document doc, Element parent, String name) {
        Element child = doc.createElementNS(CP_NAMESPACE, name);
        parent.appendChild(child);
        return child;
    }
}
