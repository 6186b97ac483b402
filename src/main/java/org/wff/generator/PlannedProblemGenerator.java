package org.wff.generator;

import org.wff.formula.Formula;
import org.wff.problem.Problem;
import org.wff.rules.Application;
import org.wff.rules.DerivationSearch;
import org.wff.rules.ForwardRule;
import org.wff.rules.ForwardRuleGenerators;
import org.wff.rules.InferenceRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * GENERATORE DI PROBLEMI PIANIFICATO - Costruzione in avanti e taglio per difficoltà
 *
 * FASE 1 - COSTRUZIONE:
 * 1. Semina: alcune variabili fresche con polarità casuale, impegnate nell'allocatore
 * 2. Impalcatura: alcune foglie vengono sostituite dalle premesse e dai sotto-obiettivi
 *    di una strategia all'indietro compatibile, scelta tra reverse-Conjunction,
 *    reverse-HypotheticalSyllogism e reverse-ModusPonens. Le strategie inverse di DS e MT
 *    affermano la variabile fresca con entrambe le polarità (X in (X∨Q) e ¬X) e non
 *    superano mai il controllo di coerenza, quindi non vengono usate qui
 * 3. Derivazione: per difficoltà + 1 passi si sceglie una regola in avanti per peso
 *    (il peso di una regola usata viene dimezzato) e una sua applicazione a caso,
 *    preferendo con probabilità configurata quelle che usano l'ultima formula derivata
 * 4. L'ultima formula derivata è la conclusione
 *
 * FASE 2 - TAGLIO:
 * Partendo dalla conclusione, la frontiera viene espansa sostituendo ogni nodo derivato
 * con i suoi antecedenti finché resta budget (difficoltà, limitata alla profondità della
 * conclusione). Le formule della frontiera finale sono le premesse; la difficoltà
 * registrata è il numero di nodi nascosti.
 *
 * VERIFICHE:
 * • premesse non vuote e diverse dalla conclusione
 * • nessun letterale insieme al suo opposto tra le premesse
 * • conclusione derivabile dalle sole premesse (se configurato)
 *
 * Un tentativo che non supera le verifiche viene scartato; dopo il numero massimo di
 * tentativi il risultato è null.
 *
 * Ogni tentativo lavora su grafo e allocatore propri; l'unico stato condiviso tra le
 * chiamate è il contatore degli identificativi, atomico.
 */
public final class PlannedProblemGenerator {

    private static final Logger LOGGER = Logger.getLogger(PlannedProblemGenerator.class.getName());

    private final GeneratorConfiguration config;
    /** Strategie all'indietro usate per l'impalcatura */
    private static final List<GenerationStrategy> SCAFFOLD_STRATEGIES = List.of(
            RuleGenerators.REVERSE_CONJUNCTION,
            RuleGenerators.REVERSE_HYPOTHETICAL_SYLLOGISM,
            RuleGenerators.REVERSE_MODUS_PONENS);

    private final Random random;
    private final AtomicInteger generatedCount = new AtomicInteger();

    /**
     * Risultato del taglio del grafo.
     *
     * @param premiseIds nodi rivelati come premesse
     * @param hiddenCount nodi derivati nascosti
     */
    public record Cut(List<Integer> premiseIds, int hiddenCount) {
        public Cut {
            premiseIds = List.copyOf(premiseIds);
        }
    }

    /** Esito della semina: allocatore aggiornato e foglie del grafo. */
    private record Seeding(VarLists vars, List<Formula> leaves) {}

    public PlannedProblemGenerator(Random random) {
        this(GeneratorConfiguration.defaults(), random);
    }

    /**
     * @param config parametri del generatore
     * @param random sorgente di casualità (con seme fisso per risultati riproducibili)
     */
    public PlannedProblemGenerator(GeneratorConfiguration config, Random random) {
        if (config == null || random == null) {
            throw new IllegalArgumentException("Configurazione e sorgente casuale non possono essere null");
        }
        this.config = config;
        this.random = random;
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Genera un problema risolvibile con la difficoltà richiesta.
     *
     * @param difficulty difficoltà richiesta (>= 1)
     * @return problema generato o null se tutti i tentativi falliscono
     * @throws IllegalArgumentException se la difficoltà è minore di 1
     */
    public Problem generate(int difficulty) {
        if (difficulty < 1) {
            throw new IllegalArgumentException("Difficoltà deve essere >= 1, ricevuto: " + difficulty);
        }

        for (int attempt = 1; attempt <= config.getMaxAttempts(); attempt++) {
            Problem problem = attempt(difficulty);
            if (problem != null) {
                int attempts = attempt;
                LOGGER.fine(() -> "Problema generato al tentativo " + attempts + ": " + problem);
                return problem;
            }
        }

        LOGGER.warning("Generazione fallita dopo " + config.getMaxAttempts() + " tentativi (difficoltà " + difficulty + ")");
        return null;
    }

    /**
     * Fase 2: seleziona le premesse tagliando il grafo a partire dalla conclusione.
     *
     * @param graph grafo di derivazione
     * @param conclusionId nodo della conclusione
     * @param difficulty budget richiesto
     * @return nodi rivelati e numero di nodi nascosti
     */
    public static Cut cut(DerivationGraph graph, int conclusionId, int difficulty) {
        int budget = Math.min(difficulty, graph.depth(conclusionId));
        Set<Integer> frontier = new LinkedHashSet<>(List.of(conclusionId));
        Set<Integer> hidden = new LinkedHashSet<>();

        while (budget > 0 && hasDerivedNode(graph, frontier)) {
            Set<Integer> next = new LinkedHashSet<>();
            for (int id : frontier) {
                DerivationGraph.Node node = graph.getNode(id);
                if (node.isLeaf() || budget == 0) {
                    next.add(id);
                } else {
                    next.addAll(node.antecedents());
                    hidden.add(id);
                    budget--;
                }
            }
            next.removeAll(hidden);
            frontier = next;
        }

        return new Cut(new ArrayList<>(frontier), hidden.size());
    }

    //endregion

    //region TENTATIVO DI GENERAZIONE

    private Problem attempt(int difficulty) {
        Seeding seeding = seed(difficulty);
        LOGGER.finest(() -> "Foglie iniziali " + seeding.leaves() + ", " + seeding.vars());

        DerivationGraph graph = new DerivationGraph();
        for (Formula leaf : seeding.leaves()) graph.addLeaf(leaf);

        int conclusionId = construct(graph, difficulty);
        if (conclusionId < 0) {
            LOGGER.finest("Tentativo scartato: nessuna formula derivata");
            return null;
        }

        Cut cut = cut(graph, conclusionId, difficulty);
        Formula conclusion = graph.getNode(conclusionId).formula();
        List<Formula> premises = new ArrayList<>();
        for (int id : cut.premiseIds()) premises.add(graph.getNode(id).formula());

        if (premises.isEmpty() || premises.contains(conclusion)) {
            LOGGER.finest("Tentativo scartato: premesse vuote o coincidenti con la conclusione");
            return null;
        }
        if (!VarLists.isConsistent(premises) || Problem.hasContradictoryPair(premises)) {
            LOGGER.finest(() -> "Tentativo scartato: premesse contraddittorie " + premises);
            return null;
        }
        if (config.isVerifySolvability() && !DerivationSearch.canDerive(premises, conclusion)) {
            LOGGER.fine(() -> "Tentativo scartato: " + conclusion + " non derivabile da " + premises);
            return null;
        }

        int number = generatedCount.incrementAndGet();
        return new Problem("gen-" + number, "Problema generato " + number,
                premises, conclusion, cut.hiddenCount());
    }

    /**
     * Fase 1, passi 1-2: variabili di partenza e impalcatura all'indietro.
     */
    private Seeding seed(int difficulty) {
        VarLists vars = VarLists.create(config.getVariables(), random);
        List<Formula> leaves = new ArrayList<>();

        int seeds = difficulty <= 3 ? 2 : 3;
        for (int i = 0; i < seeds; i++) {
            Formula fresh = vars.drawFreshVariable();
            if (fresh == null) break;
            Formula literal = random.nextBoolean() ? fresh : Formula.not(fresh);
            vars.useAtomicAssertion(literal);
            leaves.add(literal);
        }

        int expansions = 1 + difficulty / 3;
        for (int e = 0; e < expansions && !leaves.isEmpty(); e++) {
            int index = random.nextInt(leaves.size());
            Formula goal = leaves.get(index);

            List<GenerationStrategy> strategies = scaffoldStrategies(goal);
            Collections.shuffle(strategies, random);
            for (GenerationStrategy strategy : strategies) {
                VarLists trial = vars.copy();
                GenerationStep step = strategy.generate(goal, trial);
                if (step == null) continue;

                List<Formula> expanded = new ArrayList<>(leaves);
                expanded.remove(index);
                for (Formula formula : step.allFormulas()) {
                    if (!expanded.contains(formula)) expanded.add(formula);
                }
                if (!commitAssertions(trial, step.allFormulas()) || !VarLists.isConsistent(expanded)) continue;

                LOGGER.finest(() -> strategy.getName() + " su " + goal + ": " + step);
                vars = trial;
                leaves = expanded;
                break;
            }
        }
        return new Seeding(vars, leaves);
    }

    /**
     * @return strategie di impalcatura compatibili con l'obiettivo, in lista modificabile
     */
    static List<GenerationStrategy> scaffoldStrategies(Formula goal) {
        List<GenerationStrategy> result = new ArrayList<>();
        for (GenerationStrategy strategy : SCAFFOLD_STRATEGIES) {
            if (strategy.canApply(goal)) result.add(strategy);
        }
        return result;
    }

    static boolean commitAssertions(VarLists vars, List<Formula> formulas) {
        Set<Formula> assertions = new LinkedHashSet<>();
        for (Formula formula : formulas) assertions.addAll(VarLists.getAtomicAssertions(formula));
        return vars.useAll(assertions);
    }

    /**
     * Fase 1, passi 3-4: derivazione in avanti con scelta pesata delle regole.
     *
     * @return nodo della conclusione o -1 se nessuna formula è stata derivata
     */
    private int construct(DerivationGraph graph, int difficulty) {
        Map<InferenceRule, Double> weights = new EnumMap<>(InferenceRule.class);
        for (ForwardRule rule : ForwardRuleGenerators.ALL) weights.put(rule.getRule(), rule.getWeight());

        int lastId = -1;
        Formula lastDerived = null;
        int steps = difficulty + 1;

        for (int step = 0; step < steps; step++) {
            Map<ForwardRule, List<Application>> candidates = collectCandidates(graph);
            if (candidates.isEmpty()) break;

            if (lastDerived != null && random.nextDouble() < config.getChainBias()) {
                Map<ForwardRule, List<Application>> chained = chainedCandidates(candidates, lastDerived);
                if (!chained.isEmpty()) candidates = chained;
            }

            ForwardRule chosen = chooseWeighted(candidates, weights);
            List<Application> applications = candidates.get(chosen);
            Application application = applications.get(random.nextInt(applications.size()));

            lastId = graph.addDerived(application);
            lastDerived = application.conclusion();
            weights.put(chosen.getRule(), weights.get(chosen.getRule()) / 2);
            LOGGER.finest(() -> "Passo derivato: " + application);
        }
        return lastId;
    }

    private Map<ForwardRule, List<Application>> collectCandidates(DerivationGraph graph) {
        List<Formula> known = graph.getFormulas();
        Map<ForwardRule, List<Application>> candidates = new LinkedHashMap<>();
        for (ForwardRule rule : ForwardRuleGenerators.ALL) {
            List<Application> usable = new ArrayList<>();
            for (Application application : rule.generate(known)) {
                Formula conclusion = application.conclusion();
                if (!graph.contains(conclusion) && conclusion.getNode().size() <= config.getMaxFormulaSize()) {
                    usable.add(application);
                }
            }
            if (!usable.isEmpty()) candidates.put(rule, usable);
        }
        return candidates;
    }

    private static Map<ForwardRule, List<Application>> chainedCandidates(Map<ForwardRule, List<Application>> candidates,
                                                                         Formula lastDerived) {
        Map<ForwardRule, List<Application>> chained = new LinkedHashMap<>();
        for (Map.Entry<ForwardRule, List<Application>> entry : candidates.entrySet()) {
            List<Application> using = new ArrayList<>();
            for (Application application : entry.getValue()) {
                if (application.antecedents().contains(lastDerived)) using.add(application);
            }
            if (!using.isEmpty()) chained.put(entry.getKey(), using);
        }
        return chained;
    }

    private ForwardRule chooseWeighted(Map<ForwardRule, List<Application>> candidates, Map<InferenceRule, Double> weights) {
        double total = 0;
        for (ForwardRule rule : candidates.keySet()) total += weights.get(rule.getRule());

        double point = random.nextDouble() * total;
        ForwardRule chosen = null;
        for (ForwardRule rule : candidates.keySet()) {
            chosen = rule;
            point -= weights.get(rule.getRule());
            if (point <= 0) break;
        }
        return chosen;
    }

    private static boolean hasDerivedNode(DerivationGraph graph, Set<Integer> frontier) {
        for (int id : frontier) {
            if (!graph.getNode(id).isLeaf()) return true;
        }
        return false;
    }

    //endregion
}
