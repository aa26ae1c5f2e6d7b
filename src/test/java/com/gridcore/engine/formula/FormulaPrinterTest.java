package com.gridcore.engine.formula;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class FormulaPrinterTest {

    /**
     * Printing keeps only the parentheses the tree needs.
     */
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "A1 + B1 * 2      | A1+B1*2",
            "(A1 + B1) * 2    | (A1+B1)*2",
            "((A1))           | A1",
            "1 - (2 - 3)      | 1-(2-3)",
            "(1 - 2) - 3      | 1-2-3",
            "sum( $A$1 : B2 ) | SUM($A$1:B2)",
            "-(A1 + 1)        | -(A1+1)",
            "(A1 + 1)%        | (A1+1)%",
            "\"a\"\"b\" & C1  | \"a\"\"b\"&C1"
    })
    void testPrint(String source, String expected) {
        assertEquals(expected, FormulaPrinter.print(FormulaParser.parseFormula(source)));
    }

    /**
     * Printing and parsing again yields the same tree.
     */
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "IF(A1>=10,\"big\",\"small\")",
            "2^-1",
            "-2^2",
            "A1<>B1",
            "CONCATENATE(A1,\" \",B$2)",
            "1.5E+20+0.000001"
    })
    void testReparse(String source) {
        String printed = FormulaPrinter.print(FormulaParser.parseFormula(source));
        assertEquals(FormulaParser.parseFormula(source), FormulaParser.parseFormula(printed));
    }
}
