package cc.whohow.objects.redis;

import java.util.Objects;

public class Task {
    public String name;
    public int attempts;

    public Task() {
    }

    public Task(String name, int attempts) {
        this.name = name;
        this.attempts = attempts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Task task = (Task) o;
        return attempts == task.attempts && Objects.equals(name, task.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attempts);
    }

    @Override
    public String toString() {
        return name + "#" + attempts;
    }
}
