// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package specexec.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public class Util {

    /**
     * Map a given list of elements from one kind to another.
     *
     * @param items
     * @param fn
     * @param <S>
     * @param <T>
     * @return
     */
    public static <S, T> List<T> map(List<S> items, Function<S, T> fn) {
        ArrayList<T> rs = new ArrayList<>();
        for (int i = 0; i != items.size(); ++i) {
            rs.add(fn.apply(items.get(i)));
        }
        return rs;
    }
}
