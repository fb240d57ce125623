package com.litigation.pipeline.claims;

import java.util.List;
import java.util.Set;

/**
 * The built-in legal theories. Every element has a primary question weighted 0.5, so a
 * single fact answering it satisfies the element, and corroborating questions that add
 * strength.
 */
final class DefaultCauseTemplates {

    private DefaultCauseTemplates() {
    }

    private static ElementTemplate element(String id, String definition, QuestionTemplate... questions) {
        return ElementTemplate.of(id, definition, questions);
    }

    private static QuestionTemplate question(String id, String text, double weight, String... patterns) {
        return QuestionTemplate.of(id, text, weight, patterns);
    }

    static List<CauseTemplate> all() {
        return List.of(breachOfContract(), negligence(), fraud(), defamation(), emotionalDistress());
    }

    static CauseTemplate breachOfContract() {
        return new CauseTemplate("breach_of_contract", "Breach of Contract", "contract", Set.of(), List.of(
                element("contract_formation", "A valid contract was formed by offer, acceptance and consideration.",
                        question("agreement_exists", "Was there an agreement between the parties?", 0.5,
                                "contract|agreement|offer|accept"),
                        question("consideration_given", "Was the agreement signed or supported by consideration?", 0.3,
                                "sign|execut|consideration|deposit|paid")),
                element("performance", "The plaintiff performed or was excused from performing.",
                        question("plaintiff_performed", "Did the plaintiff perform its obligations?", 0.5,
                                "deliver|perform|ship|fulfil"),
                        question("performance_accepted", "Was performance tendered or accepted?", 0.3,
                                "tender|complet|satisf")),
                element("breach", "The defendant failed to perform a contractual obligation.",
                        question("obligation_unmet", "Did the defendant fail to perform as promised?", 0.5,
                                "defective|defect|nonconforming|breach|fail|refus"),
                        question("terms_violated", "Were specific terms violated?", 0.3,
                                "violat|late|non-?performance")),
                element("damages", "The breach caused the plaintiff a loss.",
                        question("loss_suffered", "Did the plaintiff suffer a loss?", 0.5,
                                "refund|loss|damage|cost|harm|injur"),
                        question("loss_quantified", "Can the loss be quantified?", 0.3,
                                "\\$|amount|invoice|price|compensat"))
        ));
    }

    static CauseTemplate negligence() {
        return new CauseTemplate("negligence", "Negligence", "tort", Set.of(), List.of(
                element("duty", "The defendant owed the plaintiff a duty of care.",
                        question("duty_owed", "Did the defendant owe a duty of care?", 0.5,
                                "duty|owe|standard of care|obligation to"),
                        question("relationship", "Did the parties stand in a relationship creating a duty?", 0.3,
                                "custom|patient|tenant|driver|invitee")),
                element("breach", "The defendant fell below the standard of care.",
                        question("unreasonable_conduct", "Did the defendant act unreasonably?", 0.5,
                                "negligen|careless|unreasonabl|reckless"),
                        question("standard_violated", "Was a safety rule or standard violated?", 0.3,
                                "violat|unsafe|hazard")),
                element("causation", "The breach actually and proximately caused the harm.",
                        question("harm_caused", "Did the conduct cause the harm?", 0.5,
                                "caus|result|proximate|led to"),
                        question("foreseeable", "Was the harm foreseeable?", 0.3,
                                "foresee|predictab")),
                element("damages", "The plaintiff suffered actual injury.",
                        question("injury_suffered", "Did the plaintiff suffer injury or loss?", 0.5,
                                "injur|harm|damage|loss|medical"),
                        question("injury_quantified", "Are the damages documented?", 0.3,
                                "bill|expense|wage|compensat"))
        ));
    }

    static CauseTemplate fraud() {
        return new CauseTemplate("fraud", "Fraud", "fraud", Set.of(), List.of(
                element("misrepresentation", "The defendant made a false representation of material fact.",
                        question("false_statement", "Did the defendant make a false statement?", 0.5,
                                "false|misrepresent|lie|untrue"),
                        question("material_fact", "Did the statement concern a material fact?", 0.3,
                                "material|represent|statement")),
                element("scienter", "The defendant knew the representation was false.",
                        question("knew_false", "Did the defendant know the statement was false?", 0.5,
                                "knew|knowing|knowledge|reckless disregard")),
                element("intent", "The defendant intended to induce reliance.",
                        question("intended_reliance", "Did the defendant intend the plaintiff to rely?", 0.5,
                                "intend|induce|deceiv|purpose")),
                element("reliance", "The plaintiff justifiably relied on the representation.",
                        question("plaintiff_relied", "Did the plaintiff rely on the statement?", 0.5,
                                "rel(y|ied|iance)|depend|trust")),
                element("damages", "The reliance caused the plaintiff a loss.",
                        question("loss_suffered", "Did the plaintiff suffer a loss?", 0.5,
                                "loss|damage|harm|paid|cost"))
        ));
    }

    static CauseTemplate defamation() {
        return new CauseTemplate("defamation", "Defamation", "tort", Set.of(), List.of(
                element("defamatory_statement", "A statement tending to harm reputation was made.",
                        question("statement_made", "Was a defamatory statement made?", 0.5,
                                "defamat|libel|slander|reputation")),
                element("publication", "The statement was communicated to a third party.",
                        question("statement_published", "Was the statement published to others?", 0.5,
                                "publish|post|broadcast|communicat|third part|disseminat")),
                element("falsity", "The statement was false.",
                        question("statement_false", "Was the statement false?", 0.5,
                                "false|untrue|inaccurate|incorrect")),
                element("damages", "The statement caused harm.",
                        question("harm_suffered", "Did the plaintiff suffer harm?", 0.5,
                                "damage|harm|loss|lost (business|client|job)"))
        ));
    }

    static CauseTemplate emotionalDistress() {
        return new CauseTemplate("intentional_infliction_of_emotional_distress",
                "Intentional Infliction of Emotional Distress", "tort", Set.of(), List.of(
                element("extreme_outrageous_conduct", "The conduct exceeded all bounds tolerated in society.",
                        question("outrageous", "Was the conduct extreme and outrageous?", 0.5,
                                "extreme|outrageous|shocking|atrocious")),
                element("intent_recklessness", "The defendant intended or recklessly disregarded the distress.",
                        question("intended_distress", "Did the defendant intend or disregard the distress?", 0.5,
                                "intent|purpose|reckless|disregard")),
                element("causation", "The conduct caused the distress.",
                        question("distress_caused", "Did the conduct cause the distress?", 0.5,
                                "caus|result|led to")),
                element("severe_emotional_distress", "The plaintiff suffered severe emotional distress.",
                        question("severe_distress", "Was the distress severe?", 0.5,
                                "severe|emotional|distress|trauma|anxiety"))
        ));
    }
}
