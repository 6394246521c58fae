package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.model.*;
import io.github.trackidity.flow_finder.utils.FlowIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Selects the entry points of concrete contracts: implemented functions that are callable
 * from outside (public or external) and may modify state (neither view nor pure).
 * Constructors, receive and fallback qualify by the mutability rule alone.
 */
public class EntryPointClassifier {

    private static final Logger log = LoggerFactory.getLogger(EntryPointClassifier.class);

    /**
     * Locally declared entry points first, then by location, label and flow id.
     */
    public static final Comparator<EntryPoint> ORDER = Comparator
            .comparing(EntryPoint::inherited)
            .thenComparing(EntryPoint::location, Location::compare)
            .thenComparing(EntryPoint::label)
            .thenComparing(EntryPoint::flowId);

    private final AnalysisContext context;

    public EntryPointClassifier(AnalysisContext context) {
        this.context = context;
    }

    public static boolean isEntryPoint(FunctionFacts function) {
        if (!function.implemented() || !function.mutability().mayModifyState()) {
            return false;
        }
        if (function.constructor() || function.receive() || function.fallback()) {
            return true;
        }
        return function.visibility().isExternallyCallable();
    }

    /**
     * Whether entry points and variables are listed for this contract at all. Interfaces and
     * libraries never are; abstract contracts only when configured; dependency contracts are
     * hidden while dependencies are excluded.
     */
    public boolean isConcrete(ContractFacts contract) {
        boolean kindListed = switch (contract.kind()) {
            case CONTRACT -> true;
            case ABSTRACT -> context.config().includeAbstract();
            case INTERFACE, LIBRARY -> false;
        };
        if (!kindListed) {
            return false;
        }
        return !(context.config().excludeDependencies() && context.isDependency(contract));
    }

    public List<EntryPoint> classify(EffectiveContract effective) {
        ContractFacts contract = effective.contract();
        List<EntryPoint> entryPoints = new ArrayList<>();
        boolean hasOwnConstructor = false;
        for (Member<FunctionFacts> member : effective.functions().values()) {
            FunctionFacts function = member.declaration();
            if (function.constructor()) {
                hasOwnConstructor = true;
            }
            if (isEntryPoint(function)) {
                entryPoints.add(toEntryPoint(contract, member));
            }
        }
        // Deploying a contract without its own constructor runs the inherited ones
        if (!hasOwnConstructor) {
            for (ContractFacts ancestor : effective.ancestors()) {
                for (FunctionFacts function : ancestor.functions()) {
                    if (function.constructor() && isEntryPoint(function)) {
                        entryPoints.add(toEntryPoint(contract, new Member<>(function, ancestor, true)));
                    }
                }
            }
        }
        entryPoints.sort(ORDER);
        log.debug("{}: {} entry points", contract.name(), entryPoints.size());
        return entryPoints;
    }

    private EntryPoint toEntryPoint(ContractFacts contract, Member<FunctionFacts> member) {
        FunctionFacts function = member.declaration();
        ContractFacts declaring = member.declaringContract();
        String flowId = member.inherited()
                ? FlowIds.inheritedFlowId(contract, function, declaring)
                : FlowIds.ownFlowId(contract, function);
        String tooltip = FlowIds.canonicalName(declaring, function) + " • " + contract.file();
        Location location = function.location() != null ? function.location() : Location.unknown(declaring.file());
        return new EntryPoint(flowId, FlowIds.label(function), function, contract, declaring, member.inherited(),
                tooltip, location);
    }
}
