package org.javai.eg.clif;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.eg.config.EgSettings;
import org.javai.eg.config.EgSettingsLoader;
import org.javai.eg.editor.EgEditor;
import org.javai.eg.model.HookRef;
import org.javai.eg.model.Predicate;
import org.javai.eg.model.SheetOfAssertion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClifTranslatorTest {

	private EgEditor editor;

	@BeforeEach
	void setUp() {
		editor = new EgEditor();
	}

	private String translate() {
		return new ClifTranslator(editor.registry()).translate();
	}

	@Test
	void emptyGraphTranslatesToEmptyString() {
		assertThat(translate()).isEmpty();
	}

	@Test
	void sharedLineOnSheet() {
		String p = editor.addPredicate("P", 1);
		String q = editor.addPredicate("Q", 1);
		editor.connect(HookRef.of(p, 1), HookRef.of(q, 1));

		assertThat(translate()).isEqualTo("(exists (?v1) (and (P ?v1) (Q ?v1)))");
	}

	@Test
	void lineCrossingCutQuantifiedOutside() {
		String p = editor.addPredicate("P", 1);
		String cut = editor.addCut();
		String q = editor.addPredicate("Q", 1, cut);
		editor.connect(HookRef.of(p, 1), HookRef.of(q, 1));

		assertThat(translate()).isEqualTo("(exists (?v1) (and (P ?v1) (not (Q ?v1))))");
	}

	@Test
	void lineInsideCutQuantifiedInsideNegation() {
		String cut = editor.addCut();
		String q = editor.addPredicate("Q", 1, cut);
		String r = editor.addPredicate("R", 1, cut);
		editor.connect(HookRef.of(q, 1), HookRef.of(r, 1));

		assertThat(translate()).isEqualTo("(not (exists (?v1) (and (Q ?v1) (R ?v1))))");
	}

	@Test
	void propositionInCut() {
		String cut = editor.addCut();
		editor.addPredicate("P", 0, cut);

		assertThat(translate()).isEqualTo("(not P)");
	}

	@Test
	void emptyDoubleCut() {
		editor.insertDoubleCut();

		assertThat(translate()).isEqualTo("(not (not (and)))");
	}

	@Test
	void unboundHooksGetTheirOwnVariables() {
		editor.addPredicate("P", 1);
		editor.addPredicate("Q", 1);

		assertThat(translate()).isEqualTo("(exists (?v1 ?v2) (and (P ?v1) (Q ?v2)))");
	}

	@Test
	void standaloneConstant() {
		editor.addConstant("Socrates");

		assertThat(translate()).isEqualTo("(exists (?v1) (Socrates ?v1))");
	}

	@Test
	void functionalPredicateRendersAsEquation() {
		String a = editor.addConstant("A");
		String line = editor.registry().get(a, Predicate.class).orElseThrow().hooks().get(1);
		editor.applyTotalFunctionRule("F", 2, List.of(line), SheetOfAssertion.ID);

		assertThat(translate()).isEqualTo("(exists (?v1 ?v2) (and (= ?v2 (F ?v1)) (A ?v1)))");
	}

	@Test
	void iteratedCopyWithoutLigatureSharesVariable() {
		String p = editor.addPredicate("P", 1);
		editor.connect(HookRef.of(p, 1));
		String cut = editor.addCut();
		editor.iterate(List.of(p), cut);

		assertThat(translate()).isEqualTo("(exists (?v1) (and (P ?v1) (not (P ?v1))))");
	}

	@Test
	void outputIndependentOfInsertionOrder() {
		String q = editor.addPredicate("Q", 1);
		String p = editor.addPredicate("P", 1);
		editor.connect(HookRef.of(q, 1), HookRef.of(p, 1));

		assertThat(translate()).isEqualTo("(exists (?v1) (and (P ?v1) (Q ?v1)))");
	}

	@Test
	void variablePrefixFromSettings() {
		String p = editor.addPredicate("P", 1);
		editor.connect(HookRef.of(p, 1));

		String clif = new ClifTranslator(editor.registry(), EgSettings.defaults().withVariablePrefix("?x"))
				.translate();

		assertThat(clif).isEqualTo("(exists (?x1) (P ?x1))");
	}

	@Test
	void defaultConstructorUsesBundledSettings() {
		String p = editor.addPredicate("P", 1);
		editor.connect(HookRef.of(p, 1));
		EgSettings bundled = new EgSettingsLoader().loadDefault();

		assertThat(translate()).isEqualTo(new ClifTranslator(editor.registry(), bundled).translate());
		assertThat(translate()).isEqualTo("(exists (" + bundled.variablePrefix() + "1) (P "
				+ bundled.variablePrefix() + "1))");
	}

	@Test
	void tiedChildrenWrittenInInsertionOrder() {
		String first = editor.addPredicate("P", 1);
		String second = editor.addPredicate("P", 1);
		String q = editor.addPredicate("Q", 1);
		editor.connect(HookRef.of(second, 1), HookRef.of(q, 1));
		editor.connect(HookRef.of(first, 1));

		assertThat(translate()).isEqualTo("(exists (?v1 ?v2) (and (P ?v1) (P ?v2) (Q ?v2)))");
	}

	@Test
	void translationIsRepeatable() {
		String p = editor.addPredicate("Loves", 2);
		String cut = editor.addCut();
		String q = editor.addPredicate("Loves", 2, cut);
		editor.connect(HookRef.of(p, 1), HookRef.of(q, 2));
		editor.connect(HookRef.of(p, 2), HookRef.of(q, 1));
		ClifTranslator translator = new ClifTranslator(editor.registry());

		String first = translator.translate();

		assertThat(translator.translate()).isEqualTo(first);
		assertThat(first).isEqualTo("(exists (?v1 ?v2) (and (Loves ?v1 ?v2) (not (Loves ?v2 ?v1))))");
	}
}
