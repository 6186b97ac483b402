package org.wff.generator;

import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.wff.formula.Formula;
import org.wff.rules.Application;
import org.wff.rules.InferenceRule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GRAFO DI DERIVAZIONE - DAG dei passi compiuti dal generatore
 *
 * STRUTTURA:
 * • formule e regole sono conservate in un'arena indicizzata da un intero progressivo
 * • gli archi antecedente → conseguente vivono in un {@link DirectedAcyclicGraph} di JGraphT
 *   i cui vertici sono gli stessi identificativi
 * • le foglie non hanno archi entranti; una formula compare in al più un nodo
 *
 * Gli antecedenti hanno sempre un identificativo minore del nodo.
 */
public final class DerivationGraph {

    /**
     * Vista di un nodo dell'arena.
     *
     * @param id identificativo progressivo
     * @param formula formula del nodo
     * @param rule regola che l'ha prodotta, null per le foglie
     * @param antecedents identificativi dei nodi da cui dipende, nell'ordine dell'applicazione
     */
    public record Node(int id, Formula formula, InferenceRule rule, List<Integer> antecedents) {

        public Node {
            antecedents = List.copyOf(antecedents);
        }

        public boolean isLeaf() {
            return antecedents.isEmpty();
        }
    }

    private final DirectedAcyclicGraph<Integer, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);
    private final List<Formula> formulas = new ArrayList<>();
    private final List<InferenceRule> rules = new ArrayList<>();
    private final Map<Formula, Integer> idByFormula = new HashMap<>();

    /**
     * Aggiunge una formula data.
     *
     * @return identificativo del nodo (quello esistente se la formula è già presente)
     */
    public int addLeaf(Formula formula) {
        if (formula == null || !formula.isWellFormed()) {
            throw new IllegalArgumentException("Foglia richiede una formula ben formata: " + formula);
        }
        Integer existing = idByFormula.get(formula);
        if (existing != null) return existing;
        return append(formula, null);
    }

    /**
     * Aggiunge la conclusione di un'applicazione, collegandola ai suoi antecedenti.
     *
     * @return identificativo del nuovo nodo
     * @throws IllegalArgumentException se la conclusione è già presente o un antecedente manca
     */
    public int addDerived(Application application) {
        if (idByFormula.containsKey(application.conclusion())) {
            throw new IllegalArgumentException("Formula già presente nel grafo: " + application.conclusion());
        }
        List<Integer> antecedents = new ArrayList<>();
        for (Formula antecedent : application.antecedents()) {
            Integer id = idByFormula.get(antecedent);
            if (id == null) {
                throw new IllegalArgumentException("Antecedente non presente nel grafo: " + antecedent);
            }
            if (!antecedents.contains(id)) antecedents.add(id);
        }

        int id = append(application.conclusion(), application.rule());
        for (int antecedent : antecedents) {
            dag.addEdge(antecedent, id);
        }
        return id;
    }

    private int append(Formula formula, InferenceRule rule) {
        int id = formulas.size();
        formulas.add(formula);
        rules.add(rule);
        dag.addVertex(id);
        idByFormula.put(formula, id);
        return id;
    }

    /**
     * @throws IllegalArgumentException se il nodo non esiste
     */
    public Node getNode(int id) {
        if (!dag.containsVertex(id)) {
            throw new IllegalArgumentException("Nodo inesistente: " + id);
        }
        return new Node(id, formulas.get(id), rules.get(id), Graphs.predecessorListOf(dag, id));
    }

    public boolean contains(Formula formula) {
        return idByFormula.containsKey(formula);
    }

    /**
     * @return identificativo della formula o -1 se assente
     */
    public int idOf(Formula formula) {
        return idByFormula.getOrDefault(formula, -1);
    }

    /**
     * @return formule di tutti i nodi, in ordine di inserimento
     */
    public List<Formula> getFormulas() {
        return new ArrayList<>(formulas);
    }

    public List<Node> getNodes() {
        List<Node> nodes = new ArrayList<>(formulas.size());
        for (int id = 0; id < formulas.size(); id++) nodes.add(getNode(id));
        return nodes;
    }

    /**
     * @return identificativi di tutti i nodi da cui il nodo dipende, direttamente o no
     */
    public Set<Integer> getAncestors(int id) {
        getNode(id);
        return dag.getAncestors(id);
    }

    public int size() {
        return formulas.size();
    }

    /**
     * Profondità di un nodo: 0 per le foglie, altrimenti 1 + massima profondità degli antecedenti.
     * Gli antenati vengono visitati nell'ordine topologico del DAG.
     */
    public int depth(int id) {
        Set<Integer> ancestors = getAncestors(id);
        Map<Integer, Integer> depths = new HashMap<>();
        for (int vertex : dag) {
            if (vertex != id && !ancestors.contains(vertex)) continue;
            int max = -1;
            for (int antecedent : Graphs.predecessorListOf(dag, vertex)) {
                max = Math.max(max, depths.get(antecedent));
            }
            depths.put(vertex, max + 1);
            if (vertex == id) break;
        }
        return depths.get(id);
    }
}
