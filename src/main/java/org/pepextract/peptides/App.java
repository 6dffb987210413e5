package org.pepextract.peptides;

import java.util.Arrays;

import org.pepextract.utils.BaseProcessor;

/**
 * These are the commands for extracting and validating target peptide sequences from metagenomic alignment results.
 *
 * manifest		scan an alignment root directory and write the sample manifest
 * extract		extract the target reads for a single sample in the manifest
 * summary		produce a summary table from a directory of completion records
 * validate		combine the extracted sequences, translate, validate, and produce the final protein FASTA
 * pipeline		run the whole pipeline in a single process
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1) {
            System.err.println("A command is required: manifest, extract, summary, validate, or pipeline.");
            System.exit(2);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Parse the parameters.
        switch (command) {
        case "manifest" -> processor = new ManifestProcessor();
        case "extract" -> processor = new ExtractProcessor();
        case "summary" -> processor = new SummaryProcessor();
        case "validate" -> processor = new ValidateProcessor();
        case "pipeline" -> processor = new PipelineProcessor();
        default -> throw new IllegalArgumentException("Invalid command " + command);
        }
        processor.parseCommand(newArgs);
        processor.run();
        System.exit(processor.getExitCode());
    }
}
