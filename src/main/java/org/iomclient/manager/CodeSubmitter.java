package org.iomclient.manager;

import java.nio.charset.Charset;
import java.util.Collections;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.iomclient.broker.BrokerException;
import org.iomclient.cli.OutputFormat;
import org.iomclient.cli.SessionOptions;
import org.iomclient.data.MacroPrompter;
import org.iomclient.data.PromptCancelledException;
import org.iomclient.data.SubmitResult;
import org.iomclient.manager.util.ListingFixup;

/**
 * Frames program text, submits it, collects log and listing, and resets the
 * parser after every submission.
 */
public class CodeSubmitter {

    private static final Logger LOG = LogManager.getLogger(CodeSubmitter.class.getName());

    /**
     * Closes any open quote, comment, step or statement left by earlier text.
     */
    static final String RESET_SENTINEL = ";*';*\";*/;quit;run;";
    static final String HTML_RESULT_FILE = "iomclient_results.html";
    static final String ODS_ID = "iomclient_internal";

    private final SessionManager session;
    private final MacroPrompter prompter;

    public CodeSubmitter(SessionManager session, MacroPrompter prompter) {
        this.session = session;
        this.prompter = prompter;
    }

    public SubmitResult submit(String code, OutputFormat format) throws BrokerException {
        return submit(code, format, Collections.emptyMap());
    }

    /**
     * Submit program text and return its log and listing.
     *
     * @param code    program text, sent without local validation
     * @param format  {@link OutputFormat#HTML} captures output to a file in the
     *                work directory, {@link OutputFormat#TEXT} uses the plain listing
     * @param prompts macro variables to ask for, name to hide-input flag, in
     *                the order they are asked
     * @throws PromptCancelledException if the user cancels a prompt; nothing
     *                                  is submitted in that case
     */
    public SubmitResult submit(String code, OutputFormat format, Map<String, Boolean> prompts)
            throws BrokerException {
        String macros = declareMacros(prompts);
        String program = frame(code, format, macros);

        BrokerException failure = null;
        try {
            LOG.debug("Submitting program:\n{}", program);
            session.submit(program);

            String log = session.drainLog();
            String listing;
            if (format == OutputFormat.HTML) {
                listing = readHtmlListing();
            } else {
                listing = session.drainListing();
            }

            if (LogScanner.firstError(log) != null) {
                session.markError();
            }
            return new SubmitResult(log, listing);
        } catch (BrokerException e) {
            session.markError();
            failure = e;
            throw e;
        } finally {
            // incomplete input leaves the parser rejecting everything that follows
            try {
                session.reset();
            } catch (BrokerException e) {
                if (failure == null) {
                    throw e;
                }
                failure.addSuppressed(e);
            }
        }
    }

    /**
     * Submit without collecting log or listing. The output stays in the
     * engine buffers until the next draining call.
     */
    public void submitAsync(String code, OutputFormat format) throws BrokerException {
        String program = frame(code, format, "");
        LOG.debug("Submitting program without waiting for output:\n{}", program);
        try {
            session.submit(program);
        } finally {
            session.reset();
        }
    }

    String frame(String code, OutputFormat format, String macros) {
        StringBuilder program = new StringBuilder();
        program.append(RESET_SENTINEL).append('\n');
        program.append(macros);
        if (format == OutputFormat.HTML) {
            program.append(odsOpen()).append(code).append(odsClose());
        } else {
            program.append(code);
        }
        program.append('\n').append(RESET_SENTINEL);
        return program.toString();
    }

    private String odsOpen() {
        SessionOptions options = session.getOptions();
        return "\nods listing close;\n" +
                "ods " + options.getOutput() + " (id=" + ODS_ID + ") options(bitmap_mode='inline')\n" +
                "    file=\"" + htmlResultPath() + "\"\n" +
                "    device=svg\n" +
                "    style=" + options.getHtmlStyle() + ";\n" +
                "ods graphics on / outputfmt=png;\n";
    }

    private String odsClose() {
        return "\nods " + session.getOptions().getOutput() + " (id=" + ODS_ID + ") close;\n" +
                "ods listing;\n";
    }

    String htmlResultPath() {
        return session.getWorkspacePaths().resolve(HTML_RESULT_FILE);
    }

    private String readHtmlListing() throws BrokerException {
        SessionOptions options = session.getOptions();
        byte[] content = session.readFile(htmlResultPath());
        String html = new String(content, Charset.forName(options.getEncoding()));
        return ListingFixup.applyAll(html, options.getListingFixups());
    }

    private String declareMacros(Map<String, Boolean> prompts) {
        if (prompts == null || prompts.isEmpty()) {
            return "";
        }
        if (prompter == null) {
            throw new IllegalStateException("Macro variables were requested but no prompter is configured");
        }

        StringBuilder declarations = new StringBuilder();
        for (Map.Entry<String, Boolean> entry : prompts.entrySet()) {
            String value = ask(entry.getKey(), Boolean.TRUE.equals(entry.getValue()));
            declarations.append("%let ").append(entry.getKey()).append(" = ").append(value).append(";\n");
        }
        return declarations.toString();
    }

    private String ask(String name, boolean hide) {
        while (true) {
            String value = prompter.prompt("Enter value for macro variable " + name + " ", hide);
            if (value == null) {
                throw new PromptCancelledException("Prompt for macro variable " + name + " was cancelled");
            }
            if (!value.isEmpty()) {
                return value;
            }
            LOG.warn("Input not valid.");
        }
    }
}
