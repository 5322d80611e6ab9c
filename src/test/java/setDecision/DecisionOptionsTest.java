package setDecision;

import static org.junit.Assert.*;

import java.util.Properties;
import org.junit.Test;

public class DecisionOptionsTest {

    @Test
    public void defaults() {
        DecisionOptions options = new DecisionOptions();
        assertEquals(0, options.maxSteps());
        assertEquals(DecisionOptions.Equality.LEIBNIZ, options.equality());
        assertTrue(options.congruentSubstitution());
        assertEquals(DecisionOptions.SearchOrder.DEPTH_FIRST, options.searchOrder());
        assertTrue(options.pullNegations());
    }

    @Test
    public void readsProperties() {
        Properties properties = new Properties();
        properties.setProperty(DecisionOptions.MAX_STEPS, " 250 ");
        properties.setProperty(DecisionOptions.EQUALITY, "setoid");
        properties.setProperty(DecisionOptions.SEARCH_ORDER, "breadth_first");
        properties.setProperty(DecisionOptions.PULL_NEGATIONS, "false");
        DecisionOptions options = DecisionOptions.fromProperties(properties);
        assertEquals(250, options.maxSteps());
        assertEquals(DecisionOptions.Equality.SETOID, options.equality());
        assertFalse(options.congruentSubstitution());
        assertEquals(DecisionOptions.SearchOrder.BREADTH_FIRST, options.searchOrder());
        assertFalse(options.pullNegations());
    }

    @Test
    public void missingPropertiesKeepDefaults() {
        DecisionOptions options = DecisionOptions.fromProperties(new Properties());
        assertEquals(0, options.maxSteps());
        assertEquals(DecisionOptions.Equality.LEIBNIZ, options.equality());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMalformedStepCount() {
        Properties properties = new Properties();
        properties.setProperty(DecisionOptions.MAX_STEPS, "many");
        DecisionOptions.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsUnknownEquality() {
        Properties properties = new Properties();
        properties.setProperty(DecisionOptions.EQUALITY, "syntactic");
        DecisionOptions.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeStepCount() {
        new DecisionOptions().setMaxSteps(-1);
    }
}
