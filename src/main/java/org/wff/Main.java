package org.wff;

import org.wff.formula.Formula;
import org.wff.formula.FormulaNode;
import org.wff.formula.FormulaReader;
import org.wff.generator.GeneratorConfiguration;
import org.wff.generator.PlannedProblemGenerator;
import org.wff.generator.VarLists;
import org.wff.problem.Problem;
import org.wff.problem.ProblemSets;
import org.wff.rules.DerivationSearch;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * TUTORE WFF - Interfaccia a linea di comando del nucleo logico
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Generazione (-gen=<difficoltà>): problemi risolvibili con il generatore pianificato,
 *   con numero di problemi (-n) e seme (-seed) opzionali
 * - Analisi (-parse <formula>): forma canonica, dimensioni e asserzioni atomiche
 * - Problemi curati (-sets): capitoli predefiniti con verifica di risolvibilità
 *
 * Le formule possono essere scritte con i simboli ¬ ∧ ∨ → ↔ oppure in ASCII (~ & | -> <->).
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String GEN_PARAM = "-gen=";
    private static final String COUNT_PARAM = "-n";
    private static final String SEED_PARAM = "-seed";
    private static final String PARSE_PARAM = "-parse";
    private static final String SETS_PARAM = "-sets";

    /**
     * Limiti per la generazione
     * */
    private static final int MIN_DIFFICULTY = 1;
    private static final int MAX_DIFFICULTY = 10;
    private static final int MIN_PROBLEMS = 1;
    private static final int MAX_PROBLEMS = 100;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO TUTORE WFF <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            TutorConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            switch (config.mode) {
                case GENERATE -> processGeneration(config);
                case PARSE -> processParse(config.formulaText);
                case SETS -> processProblemSets();
            }

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE TUTORE WFF <---");
        }
    }

    private static void handleGlobalError(Exception e) {
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    private static TutorConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    //endregion

    //region MODALITÀ OPERATIVE

    /**
     * Genera e stampa i problemi richiesti.
     */
    private static void processGeneration(TutorConfiguration config) {
        System.out.println("\n-->> GENERAZIONE PROBLEMI <<--");
        System.out.println("Difficoltà: " + config.difficulty);
        System.out.println("Numero problemi: " + config.count);
        System.out.println("Seme: " + (config.seed != null ? config.seed : "casuale"));
        System.out.println("=============================\n");

        Random random = config.seed != null ? new Random(config.seed) : new Random();
        PlannedProblemGenerator generator = new PlannedProblemGenerator(GeneratorConfiguration.defaults(), random);

        int generated = 0;
        for (int i = 1; i <= config.count; i++) {
            Problem problem = generator.generate(config.difficulty);
            if (problem == null) {
                System.out.println("[W] Problema " + i + ": generazione fallita");
                continue;
            }
            generated++;
            printProblem(i + ".", problem);
        }

        System.out.println("[I] Problemi generati: " + generated + "/" + config.count);
    }

    /**
     * Analizza una formula e ne stampa le proprietà.
     */
    private static void processParse(String text) {
        Formula formula = FormulaReader.read(text);
        if (formula == null) {
            System.out.println("[E] Il testo contiene simboli non ammessi: " + text);
            return;
        }
        FormulaNode node = formula.getNode();
        if (node == null) {
            System.out.println("[E] '" + formula + "' non è una formula ben formata");
            return;
        }

        System.out.println("\n-->> ANALISI FORMULA <<--");
        System.out.println("Forma canonica: " + Formula.of(node));
        System.out.println("Nodi: " + node.size() + ", profondità: " + node.depth());
        System.out.println("Asserzioni atomiche: " + VarLists.getAtomicAssertions(formula));
    }

    /**
     * Stampa i capitoli curati, verificando che ogni problema sia risolvibile.
     */
    private static void processProblemSets() {
        System.out.println("\n-->> PROBLEMI CURATI <<--");
        for (Map.Entry<String, List<Problem>> chapter : ProblemSets.chapters().entrySet()) {
            System.out.println("\n" + chapter.getKey().toUpperCase());
            for (Problem problem : chapter.getValue()) {
                printProblem(problem.getId(), problem);
                if (!DerivationSearch.canDerive(problem.getPremises(), problem.getConclusion())) {
                    System.out.println("   [W] Non derivabile con le sole regole di inferenza");
                }
            }
        }
    }

    private static void printProblem(String label, Problem problem) {
        System.out.println(label + " " + problem.getName() + " (difficoltà " + problem.getDifficulty() + ")");
        List<Formula> premises = problem.getPremises();
        for (int i = 0; i < premises.size(); i++) {
            System.out.println("   " + (i + 1) + ". " + premises.get(i));
        }
        System.out.println("   ⊢ " + problem.getConclusion());
    }

    //endregion

    //region SUPPORTO CONFIGURAZIONE

    private enum Mode {
        GENERATE,
        PARSE,
        SETS
    }

    /**
     * Configurazione di esecuzione validata.
     */
    private static class TutorConfiguration {
        final Mode mode;
        final int difficulty;
        final int count;
        final Long seed;
        final String formulaText;

        TutorConfiguration(Mode mode, int difficulty, int count, Long seed, String formulaText) {
            this.mode = mode;
            this.difficulty = difficulty;
            this.count = count;
            this.seed = seed;
            this.formulaText = formulaText;
        }
    }

    /**
     * Parser per i parametri linea di comando, con messaggi di errore informativi.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata o null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        public TutorConfiguration parse(String[] args) {
            Mode mode = null;
            int difficulty = 0;
            int count = MIN_PROBLEMS;
            Long seed = null;
            String formulaText = null;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case COUNT_PARAM -> count = parseBoundedInt(getNextArgument(args, ++i, "numero problemi"),
                            MIN_PROBLEMS, MAX_PROBLEMS, "Numero problemi");
                    case SEED_PARAM -> seed = parseSeed(getNextArgument(args, ++i, "seme"));
                    case PARSE_PARAM -> {
                        mode = exclusive(mode, Mode.PARSE);
                        formulaText = getNextArgument(args, ++i, "formula");
                    }
                    case SETS_PARAM -> mode = exclusive(mode, Mode.SETS);
                    default -> {
                        if (args[i].startsWith(GEN_PARAM)) {
                            mode = exclusive(mode, Mode.GENERATE);
                            difficulty = parseBoundedInt(args[i].substring(GEN_PARAM.length()),
                                    MIN_DIFFICULTY, MAX_DIFFICULTY, "Difficoltà");
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare una modalità: -gen=<difficoltà>, -parse <formula> o -sets");
            }
            return new TutorConfiguration(mode, difficulty, count, seed, formulaText);
        }

        private Mode exclusive(Mode current, Mode requested) {
            if (current != null && current != requested) {
                throw new IllegalArgumentException("Modalità " + requested + " non può essere combinata con " + current);
            }
            return requested;
        }

        private String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per " + description);
            }
            return args[index];
        }

        private int parseBoundedInt(String value, int min, int max, String description) {
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(description + " non valido: " + value);
            }
            if (parsed < min || parsed > max) {
                throw new IllegalArgumentException(description + " deve essere tra " + min + " e " + max + ", ricevuto: " + parsed);
            }
            return parsed;
        }

        private Long parseSeed(String value) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Seme non valido: " + value);
            }
        }
    }

    private static void printApplicationHelp() {
        System.out.println("\n::>> TUTORE WFF <<::");
        System.out.println("Parser, validatore e generatore di problemi per la logica proposizionale\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar tutore_WFF.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  1. GENERAZIONE PROBLEMI:");
        System.out.println("     -gen=<difficoltà>   Genera problemi risolvibili (1-" + MAX_DIFFICULTY + ")");
        System.out.println("     -n <numero>         Numero di problemi (1-" + MAX_PROBLEMS + ", default: 1)");
        System.out.println("     -seed <seme>        Seme per risultati riproducibili");
        System.out.println();
        System.out.println("  2. ANALISI FORMULA:");
        System.out.println("     -parse <formula>    Forma canonica e asserzioni atomiche");
        System.out.println();
        System.out.println("  3. PROBLEMI CURATI:");
        System.out.println("     -sets               Stampa i capitoli predefiniti");
        System.out.println();
        System.out.println("  4. AIUTO:");
        System.out.println("     -h                  Mostra questa guida\n");

        System.out.println("SIMBOLI AMMESSI:");
        System.out.println("  ¬ ~ !     negazione");
        System.out.println("  ∧ &       congiunzione");
        System.out.println("  ∨ |       disgiunzione");
        System.out.println("  → ->      implicazione");
        System.out.println("  ↔ <->     doppia implicazione");
        System.out.println("  a-z A-Z   variabili\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar tutore_WFF.jar -gen=4 -n 5 -seed 42");
        System.out.println("  java -jar tutore_WFF.jar -parse \"(p -> q) & ~r\"");
        System.out.println("  java -jar tutore_WFF.jar -sets\n");
    }

    //endregion
}
