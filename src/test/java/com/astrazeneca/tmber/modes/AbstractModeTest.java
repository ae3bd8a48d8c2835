package com.astrazeneca.tmber.modes;

import com.astrazeneca.tmber.Configuration;
import com.astrazeneca.tmber.exception.TaskFailedException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.testng.Assert.*;

public class AbstractModeTest {

    private static AbstractMode mode(int threads) {
        Configuration config = new Configuration();
        config.threads = threads;
        return new AbstractMode(config) {
            @Override
            public void run() {
            }
        };
    }

    @DataProvider(name = "threads")
    public Object[][] threads() {
        return new Object[][] {{1}, {3}};
    }

    @Test(dataProvider = "threads")
    public void testAllResultsAreCollected(int threads) {
        List<AbstractMode.NamedTask<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int value = i;
            tasks.add(new AbstractMode.NamedTask<>("task " + i, () -> value * value));
        }

        List<Integer> results = mode(threads).dispatch(tasks);

        Collections.sort(results);
        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            expected.add(i * i);
        }
        assertEquals(results, expected);
    }

    @Test(dataProvider = "threads")
    public void testUncheckedExceptionIsRethrown(int threads) {
        List<AbstractMode.NamedTask<Integer>> tasks = new ArrayList<>();
        tasks.add(new AbstractMode.NamedTask<>("fine", () -> 1));
        tasks.add(new AbstractMode.NamedTask<>("broken", () -> {
            throw new IllegalStateException("broken input");
        }));

        try {
            mode(threads).dispatch(tasks);
            fail("The failed task must abort dispatching");
        } catch (IllegalStateException e) {
            assertEquals(e.getMessage(), "broken input");
        }
    }

    @Test(dataProvider = "threads")
    public void testCheckedExceptionIsWrapped(int threads) {
        List<AbstractMode.NamedTask<Integer>> tasks = new ArrayList<>();
        tasks.add(new AbstractMode.NamedTask<>("reader", () -> {
            throw new IOException("no such file");
        }));

        try {
            mode(threads).dispatch(tasks);
            fail("The failed task must abort dispatching");
        } catch (TaskFailedException e) {
            assertTrue(e.getCause() instanceof IOException);
            assertTrue(e.getMessage().contains("reader"));
        }
    }

    @Test
    public void testNoTasks() {
        assertTrue(mode(2).<Integer>dispatch(Collections.emptyList()).isEmpty());
    }
}
